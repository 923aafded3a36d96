package com.starwatch.exception;

public class StarCacheException extends RuntimeException {

    public StarCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
