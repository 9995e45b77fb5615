package com.delta.propertytracker.crawl.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ListingUrlUtils {
    private static final Pattern LISTING_ID = Pattern.compile("MLC-?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern OFFSET_SEGMENT = Pattern.compile("/_Desde_\\d+");

    private ListingUrlUtils() {
    }

    /** Drops the fragment and query string; both carry only tracking data on listing links. */
    public static String stripTracking(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String cleaned = url.trim();
        int hash = cleaned.indexOf('#');
        if (hash >= 0) {
            cleaned = cleaned.substring(0, hash);
        }
        int query = cleaned.indexOf('?');
        if (query >= 0) {
            cleaned = cleaned.substring(0, query);
        }
        return cleaned.isBlank() ? null : cleaned;
    }

    /** Numeric listing id from an MLC-style URL, or an empty string. */
    public static String listingId(String url) {
        if (url == null) {
            return "";
        }
        Matcher matcher = LISTING_ID.matcher(url);
        return matcher.find() ? matcher.group(1) : "";
    }

    public static boolean looksLikeListingLink(String href) {
        if (href == null || href.isBlank()) {
            return false;
        }
        return href.contains("MLC") || href.toLowerCase(Locale.ROOT).contains("departamento");
    }

    /**
     * URL of result page {@code pageIndex} (1-based). Page 1 is the search URL itself;
     * page N starts at item {@code (N - 1) * pageSize + 1}.
     */
    public static String pageUrl(String searchUrl, int pageIndex, int pageSize) {
        String base = stripTracking(searchUrl);
        if (base == null) {
            throw new IllegalArgumentException("searchUrl is required");
        }
        if (pageIndex <= 1) {
            return searchUrl.trim();
        }
        base = OFFSET_SEGMENT.matcher(base).replaceAll("");
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/_Desde_" + ((pageIndex - 1) * pageSize + 1);
    }
}
