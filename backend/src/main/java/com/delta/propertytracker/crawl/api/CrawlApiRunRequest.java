package com.delta.propertytracker.crawl.api;

public record CrawlApiRunRequest(String mode, Integer maxPages, Integer maxListings) {
}
