package com.delta.propertytracker.crawl.browser;

public enum WaitPolicy {
    DOM_CONTENT_LOADED,
    FULL_LOAD
}
