package com.delta.propertytracker.crawl.model;

public record CrawlRunRequest(CrawlRunMode mode, Integer maxPages, Integer maxListings) {

    public static CrawlRunRequest of(CrawlRunMode mode) {
        return new CrawlRunRequest(mode, null, null);
    }
}
