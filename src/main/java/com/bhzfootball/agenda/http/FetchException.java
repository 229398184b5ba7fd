package com.bhzfootball.agenda.http;

/**
 * Base class of every failure raised by {@link RateLimitedFetcher}.
 */
public class FetchException extends RuntimeException {
    private final String url;

    public FetchException(String message, String url) {
        super(message);
        this.url = url;
    }

    public FetchException(String message, String url, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
