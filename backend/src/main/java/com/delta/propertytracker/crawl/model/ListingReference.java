package com.delta.propertytracker.crawl.model;

public record ListingReference(
    String title,
    String rawPriceText,
    String detailUrl,
    String sourceSelector,
    int pageIndex,
    String locationText
) {
    public boolean hasDetailUrl() {
        return detailUrl != null && !detailUrl.isBlank();
    }
}
