package com.delta.propertytracker.crawl.model;

import java.util.Locale;

public enum CrawlRunMode {
    /** Result pages only; listing references are exported as JSON. */
    BASIC,
    /** Result pages, detail pages, cleaning, scoring and persistence. */
    DETAILED;

    public static CrawlRunMode parse(String raw, CrawlRunMode fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return CrawlRunMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown crawl mode: " + raw, e);
        }
    }
}
