package com.medflow.backend.modules.tracking.presentation.dto;

import java.util.List;

import com.medflow.backend.modules.conflict.domain.ConflictFinding;
import com.medflow.backend.modules.tracking.application.AssignmentResult;

public record AssignmentResponse(
        TrackingStateResponse tracking,
        List<ConflictFinding> findings
) {

    public static AssignmentResponse from(AssignmentResult result) {
        return new AssignmentResponse(TrackingStateResponse.from(result.state()), result.report().findings());
    }
}
