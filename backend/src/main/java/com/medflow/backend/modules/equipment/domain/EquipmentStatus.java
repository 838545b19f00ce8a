package com.medflow.backend.modules.equipment.domain;

public enum EquipmentStatus {
    NORMAL,
    WARNING,
    BROKEN;

    public EquipmentStatus worst(EquipmentStatus other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
