package com.delta.propertytracker.crawl.browser;

@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession open();
}
