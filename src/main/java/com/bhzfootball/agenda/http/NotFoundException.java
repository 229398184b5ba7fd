package com.bhzfootball.agenda.http;

/**
 * HTTP 404. Callers treat it as "try the next identity, strategy or source", never as a reason to stop the run.
 */
public class NotFoundException extends FetchException {

    public NotFoundException(String url) {
        super("Not found: " + url, url);
    }
}
