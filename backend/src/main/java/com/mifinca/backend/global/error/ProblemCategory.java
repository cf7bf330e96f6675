package com.mifinca.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Stable rejection categories. Callers pick the response status from the category, never from the code.
 */
public enum ProblemCategory {

    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    ALREADY_EXISTS(HttpStatus.CONFLICT),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    INTEGRITY_VIOLATION(HttpStatus.CONFLICT),
    INVALID(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ProblemCategory(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
