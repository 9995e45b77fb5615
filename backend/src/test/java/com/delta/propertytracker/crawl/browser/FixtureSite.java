package com.delta.propertytracker.crawl.browser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves HTML fixtures from {@code src/test/resources/fixtures} by URL. Unknown URLs time out.
 */
public class FixtureSite implements JsoupBrowserSession.PageLoader {

    public record Visit(String url, WaitPolicy waitPolicy, int timeoutMs) {
    }

    private final Map<String, String> pages = new HashMap<>();
    private final Map<String, Integer> failuresLeft = new HashMap<>();
    private final List<Visit> visits = new ArrayList<>();

    public FixtureSite page(String url, String fixture) {
        pages.put(url, fixture);
        return this;
    }

    /** The next {@code times} loads of {@code url} time out before the fixture is served. */
    public FixtureSite failing(String url, int times) {
        failuresLeft.put(url, times);
        return this;
    }

    public BrowserSession openSession() {
        return new JsoupBrowserSession(this);
    }

    public List<Visit> visits() {
        return List.copyOf(visits);
    }

    public List<String> visitedUrls() {
        return visits.stream().map(Visit::url).toList();
    }

    @Override
    public Document load(String url, WaitPolicy waitPolicy, int timeoutMs) throws IOException {
        visits.add(new Visit(url, waitPolicy, timeoutMs));
        int left = failuresLeft.getOrDefault(url, 0);
        if (left > 0) {
            failuresLeft.put(url, left - 1);
            throw new SocketTimeoutException("Simulated timeout for " + url);
        }
        String fixture = pages.get(url);
        if (fixture == null) {
            throw new SocketTimeoutException("No fixture for " + url);
        }
        return Jsoup.parse(read(fixture), url);
    }

    public static String read(String fixture) {
        try (InputStream in = FixtureSite.class.getClassLoader().getResourceAsStream("fixtures/" + fixture)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + fixture);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
