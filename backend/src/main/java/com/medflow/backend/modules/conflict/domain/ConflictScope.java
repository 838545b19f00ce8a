package com.medflow.backend.modules.conflict.domain;

public enum ConflictScope {
    /** Capacity, equipment and dependency rules, for next-station assignment. */
    ASSIGNMENT,
    /** Capacity and equipment only, re-run while starting an exam. */
    EXAM_START
}
