package com.medflow.backend.modules.conflict.domain;

public enum ConflictType {
    CAPACITY,
    EQUIPMENT,
    DEPENDENCY,
    REVISIT
}
