package com.bhzfootball.agenda.http;

/**
 * HTTP 401/403. Credentials or access are broken for the whole run, so this aborts it.
 */
public class AuthorizationException extends FetchException {
    private final int statusCode;

    public AuthorizationException(String url, int statusCode) {
        super(String.format("Access denied (%d) for %s", statusCode, url), url);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
