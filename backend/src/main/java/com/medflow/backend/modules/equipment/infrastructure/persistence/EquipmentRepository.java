package com.medflow.backend.modules.equipment.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.medflow.backend.modules.equipment.domain.Equipment;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;

public interface EquipmentRepository extends JpaRepository<Equipment, UUID> {

    List<Equipment> findByActiveTrueOrderByStationCodeAscNameAsc();

    List<Equipment> findByStationCodeAndActiveTrueOrderByNameAsc(String stationCode);

    List<Equipment> findByStatusAndActiveTrueOrderByStationCodeAsc(EquipmentStatus status);
}
