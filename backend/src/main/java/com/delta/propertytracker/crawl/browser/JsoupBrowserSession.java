package com.delta.propertytracker.crawl.browser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;

/**
 * Browser session without a script engine: pages are fetched and parsed by Jsoup.
 * Useful for server-rendered pages, saved snapshots and tests.
 */
public class JsoupBrowserSession implements BrowserSession {

    @FunctionalInterface
    public interface PageLoader {
        Document load(String url, WaitPolicy waitPolicy, int timeoutMs) throws IOException;
    }

    private final PageLoader loader;
    private Document document;

    public JsoupBrowserSession(PageLoader loader) {
        this.loader = loader;
    }

    public static PageLoader connectLoader(String userAgent) {
        return (url, waitPolicy, timeoutMs) -> Jsoup.connect(url)
            .userAgent(userAgent)
            .timeout(timeoutMs)
            .followRedirects(true)
            .header("Accept-Language", "es-CL,es;q=0.9,en;q=0.6")
            .get();
    }

    @Override
    public void navigate(String url, WaitPolicy waitPolicy, int timeoutMs) {
        try {
            Document loaded = loader.load(url, waitPolicy, timeoutMs);
            if (loaded == null) {
                throw new NavigationException(NavigationException.Kind.ERROR, url, "No document returned for " + url, null);
            }
            document = loaded;
        } catch (SocketTimeoutException e) {
            throw new NavigationException(NavigationException.Kind.TIMEOUT, url, "Timed out loading " + url, e);
        } catch (IOException e) {
            throw new NavigationException(NavigationException.Kind.ERROR, url, "Failed to load " + url, e);
        }
    }

    @Override
    public List<ElementHandle> queryAll(String selector) {
        if (document == null) {
            return List.of();
        }
        return select(document, selector);
    }

    @Override
    public List<ElementHandle> queryAll(ElementHandle scope, String selector) {
        if (scope == null) {
            return queryAll(selector);
        }
        return select(unwrap(scope), selector);
    }

    @Override
    public String text(ElementHandle element) {
        return unwrap(element).text();
    }

    @Override
    public String attr(ElementHandle element, String name) {
        Element el = unwrap(element);
        if (!el.hasAttr(name)) {
            return null;
        }
        if ("href".equals(name) || "src".equals(name)) {
            String absolute = el.absUrl(name);
            if (!absolute.isEmpty()) {
                return absolute;
            }
        }
        return el.attr(name);
    }

    @Override
    public String pageContent() {
        return document == null ? "" : document.outerHtml();
    }

    @Override
    public String currentUrl() {
        return document == null ? null : document.location();
    }

    @Override
    public void close() {
        document = null;
    }

    private List<ElementHandle> select(Element root, String selector) {
        try {
            List<ElementHandle> handles = new ArrayList<>();
            for (Element element : root.select(selector)) {
                handles.add(new JsoupElement(element));
            }
            return handles;
        } catch (Selector.SelectorParseException e) {
            return List.of();
        }
    }

    private Element unwrap(ElementHandle handle) {
        if (handle instanceof JsoupElement jsoupElement) {
            return jsoupElement.element();
        }
        throw new IllegalArgumentException("Element does not belong to a Jsoup session");
    }

    private record JsoupElement(Element element) implements ElementHandle {
    }
}
