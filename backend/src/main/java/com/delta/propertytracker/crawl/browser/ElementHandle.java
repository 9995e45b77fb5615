package com.delta.propertytracker.crawl.browser;

/**
 * Opaque reference to a DOM element owned by the {@link BrowserSession} that returned it.
 */
public interface ElementHandle {
}
