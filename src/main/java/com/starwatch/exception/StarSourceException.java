package com.starwatch.exception;

public class StarSourceException extends RuntimeException {

    public StarSourceException(String message) {
        super(message);
    }

    public StarSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
