package com.delta.propertytracker.config;

/**
 * Immutable snapshot of {@link ScraperProperties} taken at the start of a crawl run.
 * Every crawl component reads its limits from here so a run never observes a
 * configuration change half way through.
 */
public record ScrapeConfig(
    String searchUrl,
    int pageSize,
    int cardThreshold,
    double minDelaySeconds,
    double maxDelaySeconds,
    int maxRequestsPerMinute,
    boolean avoidPeakHours,
    int peakStartHour,
    int peakEndHour,
    int peakCooldownSeconds,
    int maxListingsPerSession,
    int maxPagesPerSession,
    int maxRetriesPerListing,
    boolean saveImages,
    boolean extractCoordinates,
    boolean validateData,
    boolean usePersistentStore,
    int batchSaveSize,
    double maxFailureRate,
    int pageJitterMinMs,
    int pageJitterMaxMs,
    int navigationTimeoutMs,
    int relaxedNavigationTimeoutMs,
    int detailTimeoutMs,
    int settleMillis,
    String outputDir,
    String diagnosticsDir
) {

    public ScrapeConfig withSessionCaps(Integer maxPages, Integer maxListings) {
        if (maxPages == null && maxListings == null) {
            return this;
        }
        return new ScrapeConfig(
            searchUrl,
            pageSize,
            cardThreshold,
            minDelaySeconds,
            maxDelaySeconds,
            maxRequestsPerMinute,
            avoidPeakHours,
            peakStartHour,
            peakEndHour,
            peakCooldownSeconds,
            maxListings == null ? maxListingsPerSession : Math.max(1, maxListings),
            maxPages == null ? maxPagesPerSession : Math.max(1, maxPages),
            maxRetriesPerListing,
            saveImages,
            extractCoordinates,
            validateData,
            usePersistentStore,
            batchSaveSize,
            maxFailureRate,
            pageJitterMinMs,
            pageJitterMaxMs,
            navigationTimeoutMs,
            relaxedNavigationTimeoutMs,
            detailTimeoutMs,
            settleMillis,
            outputDir,
            diagnosticsDir
        );
    }

    public boolean isPeakHour(int hour) {
        if (peakStartHour <= peakEndHour) {
            return hour >= peakStartHour && hour <= peakEndHour;
        }
        return hour >= peakStartHour || hour <= peakEndHour;
    }
}
