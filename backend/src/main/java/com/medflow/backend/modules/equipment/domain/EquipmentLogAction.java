package com.medflow.backend.modules.equipment.domain;

public enum EquipmentLogAction {
    REGISTER,
    REPORT_FAILURE,
    REPORT_WARNING,
    REPAIR
}
