package com.delta.propertytracker.crawl.persistence;

import java.util.Map;

public record PropertyStats(
    long totalCount,
    Map<String, Long> fieldCoverage,
    Double averagePriceUf,
    Double averageAreaM2,
    long recentCount,
    long recentWindowHours
) {
}
