package com.bhzfootball.agenda.http;

/**
 * Any other non-2xx status. Carries the response body for diagnostics.
 */
public class HttpStatusException extends FetchException {
    private final int statusCode;
    private final String body;

    public HttpStatusException(String url, int statusCode, String body) {
        super(String.format("HTTP %d from %s: %s", statusCode, url, abbreviate(body)), url);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
