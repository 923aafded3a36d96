package com.starwatch.exception;

/**
 * Transport-level source failure (connection error, 5xx) that may succeed on retry.
 */
public class StarSourceUnavailableException extends StarSourceException {

    public StarSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
