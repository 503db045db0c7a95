package com.projectdesk;

import java.util.Locale;

/**
 * Failure categories surfaced to callers. Each maps to one HTTP status.
 */
public enum ErrorKind {
    PATH_ESCAPE(403),
    MISSING_INPUT(422),
    NOT_STAGED(404),
    ALREADY_EXISTS(409),
    GENERATION_FAILURE(502),
    UNKNOWN_PROJECT(404),
    NOT_FOUND(404),
    INVALID_REQUEST(400);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
