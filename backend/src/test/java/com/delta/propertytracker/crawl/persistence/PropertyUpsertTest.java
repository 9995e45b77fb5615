package com.delta.propertytracker.crawl.persistence;

import com.delta.propertytracker.crawl.model.PropertyRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PropertyUpsertTest {

    @Autowired
    private PropertyJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void sameListingIdIsStoredOnce() {
        PropertyRecord first = record("2001", Instant.now().minus(1, ChronoUnit.HOURS));
        first.setPrice("UF 8.500");
        repository.upsert(first);

        PropertyRecord second = record("2001", Instant.now());
        second.setPrice("UF 8.200");
        second.setPriceUf(8200.0);
        repository.upsert(second);

        assertEquals(1, countByListingId("2001"));
        PropertyRecord stored = repository.findByListingId("2001");
        assertEquals("UF 8.200", stored.getPrice());
        assertEquals(8200.0, stored.getPriceUf());
    }

    @Test
    void recordsWithoutListingIdAreAlwaysInserted() {
        repository.upsert(record("", Instant.now()));
        repository.upsert(record("", Instant.now()));

        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM properties WHERE listing_id IS NULL",
            new MapSqlParameterSource(),
            Integer.class
        );
        assertEquals(2, rows);
    }

    @Test
    void listColumnsRoundTripAsJson() {
        PropertyRecord record = record("2002", Instant.parse("2024-06-15T21:00:00Z"));
        record.setAmenities(List.of("pool", "gym"));
        record.setImageUrls(List.of("https://img.example.cl/1.jpg", "https://img.example.cl/2.jpg"));
        record.setHasElevator(false);
        record.setLatitude(-33.4125);
        record.setLongitude(-70.5047);
        repository.upsert(record);

        PropertyRecord stored = repository.findByListingId("2002");

        assertThat(stored.getAmenities()).containsExactly("pool", "gym");
        assertThat(stored.getImageUrls()).hasSize(2);
        assertEquals(Boolean.FALSE, stored.getHasElevator());
        assertNull(stored.getBedrooms());
        assertEquals(Instant.parse("2024-06-15T21:00:00Z"), stored.getScrapedAt());
        assertEquals(Boolean.TRUE, jdbc.queryForObject(
            "SELECT has_pool FROM properties WHERE listing_id = :id",
            new MapSqlParameterSource("id", "2002"),
            Boolean.class
        ));
    }

    @Test
    void blankListingIdIsRejectedByTheStore() {
        assertThatThrownBy(() -> jdbc.update(
            "INSERT INTO properties (listing_id, scraped_at) VALUES ('  ', CURRENT_TIMESTAMP)",
            new MapSqlParameterSource()
        )).isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void rejectedInsertIsReportedInsteadOfDropped() {
        PropertyRecord oversized = record("987654", Instant.now());
        oversized.setTitle("Departamento ".repeat(120));

        assertThatThrownBy(() -> repository.upsert(oversized))
            .isInstanceOf(DataIntegrityViolationException.class);
        assertEquals(0, countByListingId("987654"));
    }

    @Test
    void statsCoverEveryStoredRow() {
        PropertyRecord priced = record("2003", Instant.now());
        priced.setPriceUf(8000.0);
        priced.setTotalAreaM2(100.0);
        priced.setBedrooms(3);
        repository.upsert(priced);
        repository.upsert(record("2004", Instant.now().minus(3, ChronoUnit.DAYS)));

        PropertyStats stats = repository.aggregateStats(Duration.ofHours(24));

        assertEquals(2, stats.totalCount());
        assertEquals(1L, stats.fieldCoverage().get("priceUf"));
        assertEquals(1L, stats.fieldCoverage().get("bedrooms"));
        assertEquals(8000.0, stats.averagePriceUf());
        assertEquals(100.0, stats.averageAreaM2());
        assertEquals(1, stats.recentCount());
        assertEquals(24, stats.recentWindowHours());
    }

    @Test
    void findRecentReturnsNewestFirst() {
        repository.upsert(record("2005", Instant.now().minus(2, ChronoUnit.HOURS)));
        repository.upsert(record("2006", Instant.now()));

        List<PropertyRecord> recent = repository.findRecent(1);

        assertThat(recent).extracting(PropertyRecord::getListingId).containsExactly("2006");
    }

    private int countByListingId(String listingId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM properties WHERE listing_id = :id",
            new MapSqlParameterSource("id", listingId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private PropertyRecord record(String listingId, Instant scrapedAt) {
        PropertyRecord record = new PropertyRecord(scrapedAt.truncatedTo(ChronoUnit.MILLIS));
        record.setListingId(listingId);
        record.setTitle("Departamento " + listingId);
        record.setUrl("https://www.portalinmobiliario.com/MLC-" + listingId + "-departamento-venta-_JM");
        return record;
    }
}
