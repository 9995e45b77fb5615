package com.delta.propertytracker.crawl.extract;

import com.delta.propertytracker.crawl.browser.BrowserSession;
import com.delta.propertytracker.crawl.browser.ElementHandle;

import java.util.ArrayList;
import java.util.List;

/**
 * Where extraction strategies read from: the whole page ({@code root == null}) or one
 * element on it, such as a listing card.
 */
public record ExtractionScope(BrowserSession session, ElementHandle root) {

    public static ExtractionScope page(BrowserSession session) {
        return new ExtractionScope(session, null);
    }

    public static ExtractionScope element(BrowserSession session, ElementHandle root) {
        return new ExtractionScope(session, root);
    }

    public List<ElementHandle> all(String selector) {
        return root == null ? session.queryAll(selector) : session.queryAll(root, selector);
    }

    public String firstText(String selector) {
        List<ElementHandle> matches = all(selector);
        if (matches.isEmpty()) {
            return null;
        }
        return clean(session.text(matches.get(0)));
    }

    public String firstAttr(String selector, String attribute) {
        List<ElementHandle> matches = all(selector);
        if (matches.isEmpty()) {
            return null;
        }
        return clean(session.attr(matches.get(0), attribute));
    }

    public List<String> texts(String selector) {
        List<String> texts = new ArrayList<>();
        for (ElementHandle element : all(selector)) {
            String text = clean(session.text(element));
            if (text != null) {
                texts.add(text);
            }
        }
        return texts;
    }

    /** Text of the scope itself: the card's own text, or the page body. */
    public String ownText() {
        return clean(root == null ? session.pageText() : session.text(root));
    }

    public String ownAttr(String attribute) {
        return root == null ? null : clean(session.attr(root, attribute));
    }

    public String pageText() {
        return session.pageText();
    }

    public String pageContent() {
        return session.pageContent();
    }

    static String clean(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = value.replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }
}
