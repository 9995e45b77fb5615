package com.delta.propertytracker.crawl.discovery;

public enum DiscoveryStopReason {
    PAGE_CAP,
    LAST_PAGE,
    NAVIGATION_FAILED,
    BLOCKED,
    NO_LISTINGS,
    INTERRUPTED,
    ERROR
}
