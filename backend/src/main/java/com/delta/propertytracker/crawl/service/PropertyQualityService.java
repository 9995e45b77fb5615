package com.delta.propertytracker.crawl.service;

import com.delta.propertytracker.crawl.model.PropertyRecord;
import com.delta.propertytracker.crawl.persistence.PropertyPersistenceGateway;
import com.delta.propertytracker.crawl.validation.PropertyRecordScorer;
import com.delta.propertytracker.crawl.validation.ValidationResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-scores the most recently stored listings so data quality can be checked without
 * running a crawl.
 */
@Service
public class PropertyQualityService {
    static final int MAX_LIMIT = 500;

    private final PropertyPersistenceGateway gateway;
    private final PropertyRecordScorer scorer;

    public PropertyQualityService(PropertyPersistenceGateway gateway, PropertyRecordScorer scorer) {
        this.gateway = gateway;
        this.scorer = scorer;
    }

    public QualityReport report(int limit) {
        int bounded = Math.min(MAX_LIMIT, Math.max(1, limit));
        List<PropertyRecord> records = gateway.findRecent(bounded);
        List<ListingQuality> listings = new ArrayList<>();
        Map<String, Integer> issueCounts = new LinkedHashMap<>();
        int valid = 0;
        long scoreTotal = 0;
        for (PropertyRecord record : records) {
            ValidationResult result = scorer.score(record);
            scoreTotal += result.score();
            if (result.valid()) {
                valid++;
            }
            for (String issue : result.issues()) {
                issueCounts.merge(issue, 1, Integer::sum);
            }
            listings.add(new ListingQuality(record.getListingId(), record.getTitle(), result.score(), result.valid(), result.issues()));
        }
        Double average = records.isEmpty() ? null : (double) scoreTotal / records.size();
        return new QualityReport(records.size(), valid, average, issueCounts, listings);
    }

    public record QualityReport(
        int checked,
        int validRecords,
        Double averageScore,
        Map<String, Integer> issueCounts,
        List<ListingQuality> listings
    ) {
    }

    public record ListingQuality(String listingId, String title, int score, boolean valid, List<String> issues) {
    }
}
