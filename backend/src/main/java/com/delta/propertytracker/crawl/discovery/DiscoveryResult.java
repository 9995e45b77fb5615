package com.delta.propertytracker.crawl.discovery;

import com.delta.propertytracker.crawl.model.ListingReference;

import java.nio.file.Path;
import java.util.List;

public record DiscoveryResult(
    List<ListingReference> references,
    int pagesVisited,
    DiscoveryStopReason stopReason,
    String blockingKeyword,
    Path diagnosticsFile
) {
    public boolean blocked() {
        return stopReason == DiscoveryStopReason.BLOCKED;
    }
}
