package com.starwatch.exception;

public class SyncCancelledException extends RuntimeException {

    public SyncCancelledException(String message) {
        super(message);
    }

    public SyncCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
