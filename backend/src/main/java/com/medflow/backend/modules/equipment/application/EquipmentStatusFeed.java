package com.medflow.backend.modules.equipment.application;

import java.util.Map;

import com.medflow.backend.modules.equipment.domain.EquipmentStatus;

/**
 * Read-only view of equipment health per station, as consumed by the assignment engine.
 * A station's status is the worst status among its active equipment; stations without
 * equipment report {@link EquipmentStatus#NORMAL}.
 */
public interface EquipmentStatusFeed {

    EquipmentStatus statusOf(String stationCode);

    /**
     * Only stations with at least one piece of active equipment appear in the map.
     */
    Map<String, EquipmentStatus> statusByStation();
}
