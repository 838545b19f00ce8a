package com.medflow.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();

    @Test
    @DisplayName("a lock failure becomes a retryable conflict with an immediate Retry-After")
    void lockFailureIsRetryable() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/tracking/p-1/start");
        PessimisticLockingFailureException cause = new PessimisticLockingFailureException("lock timeout");

        ResponseEntity<ProblemResponse> response = handler.handleConcurrencyFailure(cause, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("0");
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo(ConcurrencyConflictException.CODE);
        assertThat(response.getBody().instance()).isEqualTo("/tracking/p-1/start");
    }

    @Test
    void retryableProblemKeepsItsCause() {
        IllegalStateException cause = new IllegalStateException("stale");
        ConcurrencyConflictException ex = new ConcurrencyConflictException("changed concurrently", cause);

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getRetryAfterSeconds()).isZero();
        assertThat(ex.retryAfterHeaderValue()).isEqualTo("0");
        assertThatThrownBy(() -> new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, "BUSY", null, -1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void plainProblemHasNoRetryAfter() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/patients/x");

        ResponseEntity<ProblemResponse> response = handler.handleProblemException(NotFoundException.patient("x"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getHeaders().containsKey(HttpHeaders.RETRY_AFTER)).isFalse();
        assertThat(response.getBody().code()).isEqualTo("PATIENT_NOT_FOUND");
    }
}
