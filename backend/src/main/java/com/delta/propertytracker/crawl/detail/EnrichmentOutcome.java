package com.delta.propertytracker.crawl.detail;

import com.delta.propertytracker.crawl.model.ListingReference;
import com.delta.propertytracker.crawl.model.PropertyRecord;

public record EnrichmentOutcome(ListingReference reference, PropertyRecord record, String failureReason) {

    public static EnrichmentOutcome success(ListingReference reference, PropertyRecord record) {
        return new EnrichmentOutcome(reference, record, null);
    }

    public static EnrichmentOutcome failure(ListingReference reference, String reason) {
        return new EnrichmentOutcome(reference, null, reason);
    }

    public boolean succeeded() {
        return record != null;
    }
}
