package com.delta.propertytracker.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    CrawlRunMode mode,
    int pagesVisited,
    String discoveryStopReason,
    int discovered,
    int attempted,
    int succeeded,
    int failed,
    int persisted,
    boolean failureBreakerTripped,
    Integer validRecords,
    Double averageScore,
    List<String> rangeFlags,
    List<String> exportedFiles
) {
}
