package com.delta.propertytracker.crawl.validation;

import com.delta.propertytracker.crawl.model.PropertyRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Completeness score: four core checks worth 5 points and five 1-point bonuses, capped at
 * {@link ValidationResult#MAX_SCORE}. A pure function of the record's fields.
 */
@Component
public class PropertyRecordScorer {
    private static final int CORE_POINTS = 5;
    private static final int BONUS_POINTS = 1;

    public ValidationResult score(PropertyRecord record) {
        int score = 0;
        List<String> issues = new ArrayList<>();

        if (hasText(record.getPrice()) && hasText(record.getCurrency())) {
            score += CORE_POINTS;
        } else {
            issues.add("Missing price information");
        }
        if (positive(record.getBedrooms())) {
            score += CORE_POINTS;
        } else {
            issues.add("Missing bedroom count");
        }
        if (positive(record.getTotalAreaM2())) {
            score += CORE_POINTS;
        } else {
            issues.add("Missing area information");
        }
        if (hasText(record.getAddress()) || hasText(record.getNeighborhood())) {
            score += CORE_POINTS;
        } else {
            issues.add("Missing location information");
        }

        if (positive(record.getBathrooms())) {
            score += BONUS_POINTS;
        }
        if (positive(record.getParkingSpots())) {
            score += BONUS_POINTS;
        }
        if (nonZero(record.getLatitude()) && nonZero(record.getLongitude())) {
            score += BONUS_POINTS;
        }
        if (!record.getAmenities().isEmpty()) {
            score += BONUS_POINTS;
        }
        if (hasText(record.getAgentInfo())) {
            score += BONUS_POINTS;
        }
        return ValidationResult.of(Math.min(score, ValidationResult.MAX_SCORE), issues);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean positive(Number value) {
        return value != null && value.doubleValue() > 0;
    }

    private static boolean nonZero(Double value) {
        return value != null && value != 0.0;
    }
}
