package com.starwatch.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final String fullName;

    public EntityNotFoundException(String fullName) {
        super("Repository not found: " + fullName);
        this.fullName = fullName;
    }
}
