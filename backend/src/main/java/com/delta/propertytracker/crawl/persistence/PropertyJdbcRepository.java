package com.delta.propertytracker.crawl.persistence;

import com.delta.propertytracker.crawl.model.PropertyRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.JdbcUpdateAffectedIncorrectNumberOfRowsException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class PropertyJdbcRepository implements PropertyPersistenceGateway {
    private static final Logger log = LoggerFactory.getLogger(PropertyJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String UPDATE_BY_LISTING_ID = """
        UPDATE properties
        SET title = :title,
            url = :url,
            price = :price,
            price_uf = :priceUf,
            price_clp = :priceClp,
            currency = :currency,
            maintenance_fee = :maintenanceFee,
            bedrooms = :bedrooms,
            bathrooms = :bathrooms,
            total_area_m2 = :totalAreaM2,
            built_area_m2 = :builtAreaM2,
            parking_spots = :parkingSpots,
            address = :address,
            neighborhood = :neighborhood,
            comuna = :comuna,
            latitude = :latitude,
            longitude = :longitude,
            floor_number = :floorNumber,
            building_age_years = :buildingAgeYears,
            total_floors = :totalFloors,
            has_elevator = :hasElevator,
            orientation = :orientation,
            amenities = :amenities,
            has_pool = :hasPool,
            has_gym = :hasGym,
            has_security = :hasSecurity,
            image_urls = :imageUrls,
            video_url = :videoUrl,
            listing_date_text = :listingDateText,
            days_on_market = :daysOnMarket,
            agent_info = :agentInfo,
            scraped_at = :scrapedAt
        WHERE listing_id = :listingId
        """;

    private static final String INSERT = """
        INSERT INTO properties (
            listing_id, title, url, price, price_uf, price_clp, currency, maintenance_fee,
            bedrooms, bathrooms, total_area_m2, built_area_m2, parking_spots,
            address, neighborhood, comuna, latitude, longitude, floor_number,
            building_age_years, total_floors, has_elevator, orientation,
            amenities, has_pool, has_gym, has_security,
            image_urls, video_url, listing_date_text, days_on_market, agent_info, scraped_at
        ) VALUES (
            :listingId, :title, :url, :price, :priceUf, :priceClp, :currency, :maintenanceFee,
            :bedrooms, :bathrooms, :totalAreaM2, :builtAreaM2, :parkingSpots,
            :address, :neighborhood, :comuna, :latitude, :longitude, :floorNumber,
            :buildingAgeYears, :totalFloors, :hasElevator, :orientation,
            :amenities, :hasPool, :hasGym, :hasSecurity,
            :imageUrls, :videoUrl, :listingDateText, :daysOnMarket, :agentInfo, :scrapedAt
        )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PropertyJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void upsert(PropertyRecord record) {
        MapSqlParameterSource params = toParams(record);
        if (!record.hasListingId()) {
            jdbc.update(INSERT, params);
            return;
        }
        int updated = jdbc.update(UPDATE_BY_LISTING_ID, params);
        if (updated > 0) {
            return;
        }
        try {
            jdbc.update(INSERT, params);
        } catch (DuplicateKeyException e) {
            // A concurrent writer inserted the same listing between our update and insert.
            log.debug("Listing {} inserted concurrently, retrying update", record.getListingId());
            int retried = jdbc.update(UPDATE_BY_LISTING_ID, params);
            if (retried != 1) {
                throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(UPDATE_BY_LISTING_ID, 1, retried);
            }
        }
    }

    @Override
    public PropertyStats aggregateStats(Duration recentWindow) {
        Duration window = recentWindow == null || recentWindow.isNegative() ? Duration.ofHours(24) : recentWindow;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(clock.instant().minus(window)));
        return jdbc.queryForObject(
            """
                SELECT COUNT(*) AS total,
                       COUNT(price_uf) AS with_price_uf,
                       COUNT(bedrooms) AS with_bedrooms,
                       COUNT(total_area_m2) AS with_area,
                       SUM(CASE WHEN latitude IS NOT NULL AND longitude IS NOT NULL THEN 1 ELSE 0 END) AS with_coordinates,
                       SUM(CASE WHEN address IS NOT NULL AND address <> '' THEN 1 ELSE 0 END) AS with_address,
                       AVG(CASE WHEN price_uf > 0 THEN price_uf END) AS avg_price_uf,
                       AVG(CASE WHEN total_area_m2 > 0 THEN total_area_m2 END) AS avg_area,
                       SUM(CASE WHEN scraped_at >= :cutoff THEN 1 ELSE 0 END) AS recent
                FROM properties
                """,
            params,
            (rs, rowNum) -> {
                Map<String, Long> coverage = new LinkedHashMap<>();
                coverage.put("priceUf", rs.getLong("with_price_uf"));
                coverage.put("bedrooms", rs.getLong("with_bedrooms"));
                coverage.put("totalAreaM2", rs.getLong("with_area"));
                coverage.put("coordinates", rs.getLong("with_coordinates"));
                coverage.put("address", rs.getLong("with_address"));
                return new PropertyStats(
                    rs.getLong("total"),
                    coverage,
                    nullableDouble(rs, "avg_price_uf"),
                    nullableDouble(rs, "avg_area"),
                    rs.getLong("recent"),
                    window.toHours()
                );
            }
        );
    }

    @Override
    public List<PropertyRecord> findRecent(int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT *
                FROM properties
                ORDER BY scraped_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            propertyRowMapper()
        );
    }

    public PropertyRecord findByListingId(String listingId) {
        List<PropertyRecord> rows = jdbc.query(
            "SELECT * FROM properties WHERE listing_id = :listingId",
            new MapSqlParameterSource("listingId", listingId),
            propertyRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private MapSqlParameterSource toParams(PropertyRecord record) {
        return new MapSqlParameterSource()
            .addValue("listingId", record.hasListingId() ? record.getListingId() : null)
            .addValue("title", record.getTitle())
            .addValue("url", record.getUrl())
            .addValue("price", record.getPrice())
            .addValue("priceUf", record.getPriceUf())
            .addValue("priceClp", record.getPriceClp())
            .addValue("currency", record.getCurrency())
            .addValue("maintenanceFee", record.getMaintenanceFee())
            .addValue("bedrooms", record.getBedrooms())
            .addValue("bathrooms", record.getBathrooms())
            .addValue("totalAreaM2", record.getTotalAreaM2())
            .addValue("builtAreaM2", record.getBuiltAreaM2())
            .addValue("parkingSpots", record.getParkingSpots())
            .addValue("address", record.getAddress())
            .addValue("neighborhood", record.getNeighborhood())
            .addValue("comuna", record.getComuna())
            .addValue("latitude", record.getLatitude())
            .addValue("longitude", record.getLongitude())
            .addValue("floorNumber", record.getFloorNumber())
            .addValue("buildingAgeYears", record.getBuildingAgeYears())
            .addValue("totalFloors", record.getTotalFloors())
            .addValue("hasElevator", record.getHasElevator())
            .addValue("orientation", record.getOrientation())
            .addValue("amenities", toJson(record.getAmenities()))
            .addValue("hasPool", record.getHasPool())
            .addValue("hasGym", record.getHasGym())
            .addValue("hasSecurity", record.getHasSecurity())
            .addValue("imageUrls", toJson(record.getImageUrls()))
            .addValue("videoUrl", record.getVideoUrl())
            .addValue("listingDateText", record.getListingDateText())
            .addValue("daysOnMarket", record.getDaysOnMarket())
            .addValue("agentInfo", record.getAgentInfo())
            .addValue("scrapedAt", toTimestamp(record.getScrapedAt()));
    }

    private RowMapper<PropertyRecord> propertyRowMapper() {
        return (rs, rowNum) -> {
            PropertyRecord record = new PropertyRecord(toInstant(rs.getTimestamp("scraped_at")));
            record.setListingId(rs.getString("listing_id"));
            record.setTitle(rs.getString("title"));
            record.setUrl(rs.getString("url"));
            record.setPrice(rs.getString("price"));
            record.setPriceUf(nullableDouble(rs, "price_uf"));
            record.setPriceClp(nullableDouble(rs, "price_clp"));
            record.setCurrency(rs.getString("currency"));
            record.setMaintenanceFee(rs.getString("maintenance_fee"));
            record.setBedrooms(nullableInt(rs, "bedrooms"));
            record.setBathrooms(nullableInt(rs, "bathrooms"));
            record.setTotalAreaM2(nullableDouble(rs, "total_area_m2"));
            record.setBuiltAreaM2(nullableDouble(rs, "built_area_m2"));
            record.setParkingSpots(nullableInt(rs, "parking_spots"));
            record.setAddress(rs.getString("address"));
            record.setNeighborhood(rs.getString("neighborhood"));
            record.setComuna(rs.getString("comuna"));
            record.setLatitude(nullableDouble(rs, "latitude"));
            record.setLongitude(nullableDouble(rs, "longitude"));
            record.setFloorNumber(nullableInt(rs, "floor_number"));
            record.setBuildingAgeYears(nullableInt(rs, "building_age_years"));
            record.setTotalFloors(nullableInt(rs, "total_floors"));
            boolean elevator = rs.getBoolean("has_elevator");
            record.setHasElevator(rs.wasNull() ? null : elevator);
            record.setOrientation(rs.getString("orientation"));
            record.setAmenities(fromJson(rs.getString("amenities")));
            record.setImageUrls(fromJson(rs.getString("image_urls")));
            record.setVideoUrl(rs.getString("video_url"));
            record.setListingDateText(rs.getString("listing_date_text"));
            record.setDaysOnMarket(nullableInt(rs, "days_on_market"));
            record.setAgentInfo(rs.getString("agent_info"));
            return record;
        };
    }

    private String toJson(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize list column", e);
            return null;
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable list column value {}", json);
            return List.of();
        }
    }

    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
