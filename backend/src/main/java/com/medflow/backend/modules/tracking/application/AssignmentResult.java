package com.medflow.backend.modules.tracking.application;

import com.medflow.backend.modules.conflict.domain.ConflictReport;
import com.medflow.backend.modules.tracking.domain.TrackingState;

/**
 * A committed next-station assignment with the advisory findings (or, for an override, the bypassed ones).
 */
public record AssignmentResult(TrackingState state, ConflictReport report) {
}
