package com.medflow.backend.modules.conflict.domain;

import java.util.List;

public record ConflictReport(String stationCode, List<ConflictFinding> findings) {

    public ConflictReport {
        findings = List.copyOf(findings);
    }

    public boolean hasBlocking() {
        return findings.stream().anyMatch(ConflictFinding::isBlocking);
    }

    public boolean hasBlocking(ConflictType type) {
        return findings.stream().anyMatch(finding -> finding.type() == type && finding.isBlocking());
    }

    public List<ConflictFinding> ofType(ConflictType type) {
        return findings.stream().filter(finding -> finding.type() == type).toList();
    }
}
