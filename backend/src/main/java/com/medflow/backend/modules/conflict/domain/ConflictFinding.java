package com.medflow.backend.modules.conflict.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One rule outcome for a proposed assignment. {@code relatedStationCode} names the unmet predecessor
 * for dependency findings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConflictFinding(
        ConflictType type,
        ConflictSeverity severity,
        String stationCode,
        String relatedStationCode,
        String message
) {

    public static ConflictFinding of(ConflictType type, ConflictSeverity severity, String stationCode, String message) {
        return new ConflictFinding(type, severity, stationCode, null, message);
    }

    public boolean isBlocking() {
        return severity == ConflictSeverity.BLOCK;
    }
}
