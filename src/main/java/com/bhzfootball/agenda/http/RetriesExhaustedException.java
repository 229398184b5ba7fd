package com.bhzfootball.agenda.http;

/**
 * Timeouts, connection failures or HTTP 429 persisted past the attempt limit.
 */
public class RetriesExhaustedException extends FetchException {
    private final int attempts;

    public RetriesExhaustedException(String url, int attempts, Throwable cause) {
        super(String.format("Giving up on %s after %d attempts", url, attempts), url, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
