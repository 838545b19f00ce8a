package com.medflow.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Lock contention or a stale write on a patient's state. Safe to retry immediately with fresh state.
 */
public class ConcurrencyConflictException extends RetryableProblemException {

    public static final String CODE = "CONCURRENCY_CONFLICT";

    public ConcurrencyConflictException(String detail, Throwable cause) {
        super(HttpStatus.CONFLICT, CODE, detail, 0, cause);
    }
}
