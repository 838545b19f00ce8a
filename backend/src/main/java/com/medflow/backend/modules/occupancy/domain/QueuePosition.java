package com.medflow.backend.modules.occupancy.domain;

import java.util.UUID;

/**
 * Place of a waiting patient in a station queue; {@code position} is 1-based.
 */
public record QueuePosition(
        UUID patientId,
        String stationCode,
        int position,
        int queueLength,
        int estimatedWaitMinutes
) {
}
