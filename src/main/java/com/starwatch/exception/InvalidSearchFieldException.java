package com.starwatch.exception;

import lombok.Getter;

/**
 * A search named a field that is not on the allow-list.
 */
@Getter
public class InvalidSearchFieldException extends WrongQueryException {
    private final String field;

    public InvalidSearchFieldException(String usage, String field) {
        super("Unknown " + usage + " field '" + field + "'");
        this.field = field;
    }
}
