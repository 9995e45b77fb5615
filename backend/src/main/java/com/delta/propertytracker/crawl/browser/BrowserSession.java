package com.delta.propertytracker.crawl.browser;

import java.util.List;

/**
 * One browser context with a single page. Query methods never throw: a selector the
 * engine cannot evaluate behaves like a selector with no matches.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * Loads {@code url} into the page.
     *
     * @throws NavigationException when the page does not load within {@code timeoutMs}
     *     or the engine reports a network error
     */
    void navigate(String url, WaitPolicy waitPolicy, int timeoutMs);

    List<ElementHandle> queryAll(String selector);

    /** Elements matching {@code selector} underneath {@code scope}. */
    List<ElementHandle> queryAll(ElementHandle scope, String selector);

    String text(ElementHandle element);

    /** Attribute value, or {@code null} when the element does not carry it. */
    String attr(ElementHandle element, String name);

    /** Serialized HTML of the current page. */
    String pageContent();

    String currentUrl();

    default String pageText() {
        List<ElementHandle> bodies = queryAll("body");
        if (bodies.isEmpty()) {
            return "";
        }
        String text = text(bodies.get(0));
        return text == null ? "" : text;
    }

    @Override
    void close();
}
