package com.medflow.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A rejection that did not change any tracking or escort state, so the caller may resend the same
 * request. {@link RestExceptionHandler} renders the delay as a {@code Retry-After} header; zero means
 * retry at once with freshly read state.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds, Throwable cause) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
        if (cause != null) {
            initCause(cause);
        }
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public String retryAfterHeaderValue() {
        return Integer.toString(retryAfterSeconds);
    }
}
