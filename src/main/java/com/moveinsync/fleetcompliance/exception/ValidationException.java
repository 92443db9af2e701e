package com.moveinsync.fleetcompliance.exception;

import lombok.Getter;

/**
 * Rejected input: thrown before any mutation, so nothing is partially applied.
 * Mapped to HTTP 400 by GlobalExceptionHandler.
 */
@Getter
public class ValidationException extends RuntimeException {

    /** Offending request field, or null when the error is not tied to one field */
    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(String message) {
        this(null, message);
    }
}
