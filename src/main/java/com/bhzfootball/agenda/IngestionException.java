package com.bhzfootball.agenda;

/**
 * The sink could not be reached or the request could not be built.
 */
public class IngestionException extends RuntimeException {
    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
