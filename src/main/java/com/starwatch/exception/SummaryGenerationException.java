package com.starwatch.exception;

import lombok.Getter;

@Getter
public class SummaryGenerationException extends RuntimeException {
    private final String fullName;

    public SummaryGenerationException(String fullName, String message, Throwable cause) {
        super("Summary for " + fullName + " failed: " + message, cause);
        this.fullName = fullName;
    }
}
