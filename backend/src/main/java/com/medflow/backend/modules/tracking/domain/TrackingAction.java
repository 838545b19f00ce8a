package com.medflow.backend.modules.tracking.domain;

public enum TrackingAction {
    ARRIVE,
    START,
    COMPLETE,
    ASSIGN
}
