package com.bhzfootball.agenda.http;

/**
 * A 2xx response whose body could not be parsed as JSON.
 */
public class MalformedResponseException extends FetchException {

    public MalformedResponseException(String url, Throwable cause) {
        super("Response from " + url + " is not valid JSON: " + cause.getMessage(), url, cause);
    }
}
