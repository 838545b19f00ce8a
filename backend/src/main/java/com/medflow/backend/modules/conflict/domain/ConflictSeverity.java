package com.medflow.backend.modules.conflict.domain;

public enum ConflictSeverity {
    BLOCK,
    WARN,
    INFO
}
