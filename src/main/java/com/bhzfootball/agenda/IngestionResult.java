package com.bhzfootball.agenda;

/**
 * Sink response.
 * @param ok true for a 2xx status
 * @param statusCode HTTP status
 * @param raw response body as received
 */
public record IngestionResult(boolean ok, int statusCode, String raw) {
}
