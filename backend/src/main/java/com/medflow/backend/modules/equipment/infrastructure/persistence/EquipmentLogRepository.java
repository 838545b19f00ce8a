package com.medflow.backend.modules.equipment.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.medflow.backend.modules.equipment.domain.EquipmentLog;

public interface EquipmentLogRepository extends JpaRepository<EquipmentLog, UUID> {

    List<EquipmentLog> findByEquipment_IdOrderByCreatedAtDesc(UUID equipmentId);
}
