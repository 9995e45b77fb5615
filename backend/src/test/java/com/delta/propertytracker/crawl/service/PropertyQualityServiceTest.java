package com.delta.propertytracker.crawl.service;

import com.delta.propertytracker.crawl.model.PropertyRecord;
import com.delta.propertytracker.crawl.persistence.PropertyPersistenceGateway;
import com.delta.propertytracker.crawl.validation.PropertyRecordScorer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PropertyQualityServiceTest {

    @Mock
    private PropertyPersistenceGateway gateway;

    @Test
    void scoresRecentRecordsAndCountsIssues() {
        PropertyRecord complete = new PropertyRecord(Instant.EPOCH);
        complete.setListingId("1");
        complete.setPrice("UF 8.500");
        complete.setCurrency("UF");
        complete.setBedrooms(3);
        complete.setTotalAreaM2(90.0);
        PropertyRecord sparse = new PropertyRecord(Instant.EPOCH);
        sparse.setListingId("2");
        when(gateway.findRecent(50)).thenReturn(List.of(complete, sparse));

        PropertyQualityService.QualityReport report = new PropertyQualityService(gateway, new PropertyRecordScorer()).report(50);

        assertEquals(2, report.checked());
        assertEquals(1, report.validRecords());
        assertEquals(7.5, report.averageScore());
        assertEquals(2, report.issueCounts().get("Missing location information"));
        assertEquals(1, report.issueCounts().get("Missing price information"));
        assertThat(report.listings()).extracting(PropertyQualityService.ListingQuality::score).containsExactly(15, 0);
    }

    @Test
    void limitIsBounded() {
        PropertyQualityService service = new PropertyQualityService(gateway, new PropertyRecordScorer());
        when(gateway.findRecent(PropertyQualityService.MAX_LIMIT)).thenReturn(List.of());

        PropertyQualityService.QualityReport report = service.report(10_000);

        verify(gateway).findRecent(PropertyQualityService.MAX_LIMIT);
        assertEquals(0, report.checked());
        assertNull(report.averageScore());
    }
}
