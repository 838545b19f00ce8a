package com.medflow.backend.modules.conflict.domain;

import java.util.List;

import com.medflow.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class ConflictBlockedException extends ProblemException {

    public static final String CODE = "CONFLICT_BLOCKED";

    private final transient ConflictReport report;

    public ConflictBlockedException(ConflictReport report) {
        super(HttpStatus.CONFLICT, CODE, describe(report));
        this.report = report;
    }

    public ConflictReport getReport() {
        return report;
    }

    @Override
    public List<ConflictFinding> getProblemFindings() {
        return report.findings();
    }

    private static String describe(ConflictReport report) {
        String blocking = report.findings().stream()
                .filter(ConflictFinding::isBlocking)
                .map(ConflictFinding::message)
                .reduce((left, right) -> left + "; " + right)
                .orElse("blocked");
        return "Assignment to " + report.stationCode() + " blocked: " + blocking;
    }
}
