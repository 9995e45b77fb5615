package com.delta.propertytracker.crawl.browser;

public class NavigationException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        ERROR
    }

    private final Kind kind;
    private final String url;

    public NavigationException(Kind kind, String url, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
    }

    public Kind kind() {
        return kind;
    }

    public String url() {
        return url;
    }
}
