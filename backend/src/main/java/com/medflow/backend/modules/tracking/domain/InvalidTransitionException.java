package com.medflow.backend.modules.tracking.domain;

import com.medflow.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class InvalidTransitionException extends ProblemException {

    public static final String CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String detail) {
        super(HttpStatus.CONFLICT, CODE, detail);
    }

    public static InvalidTransitionException of(TrackingStatus current, TrackingAction action) {
        String from = current != null ? current.name() : "UNREGISTERED";
        return new InvalidTransitionException(action.name() + " is not allowed while " + from);
    }
}
