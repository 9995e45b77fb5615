package com.delta.propertytracker.crawl.service;

import com.delta.propertytracker.crawl.model.CrawlRunSummary;
import com.delta.propertytracker.crawl.model.ListingReference;
import com.delta.propertytracker.crawl.model.PropertyRecord;

import java.util.List;

/** A finished run: its summary plus whatever references and records were collected. */
public record CrawlRunResult(CrawlRunSummary summary, List<ListingReference> references, List<PropertyRecord> records) {
}
