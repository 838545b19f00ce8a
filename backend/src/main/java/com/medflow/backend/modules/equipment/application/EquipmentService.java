package com.medflow.backend.modules.equipment.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.modules.audit.application.AuditLogService;
import com.medflow.backend.modules.equipment.domain.Equipment;
import com.medflow.backend.modules.equipment.domain.EquipmentLog;
import com.medflow.backend.modules.equipment.domain.EquipmentLogAction;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.equipment.infrastructure.persistence.EquipmentLogRepository;
import com.medflow.backend.modules.equipment.infrastructure.persistence.EquipmentRepository;
import com.medflow.backend.modules.station.application.StationRegistryService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class EquipmentService implements EquipmentStatusFeed {

    private static final Logger log = LoggerFactory.getLogger(EquipmentService.class);

    private final EquipmentRepository equipmentRepository;
    private final EquipmentLogRepository equipmentLogRepository;
    private final StationRegistryService stationRegistryService;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public EquipmentService(
            EquipmentRepository equipmentRepository,
            EquipmentLogRepository equipmentLogRepository,
            StationRegistryService stationRegistryService,
            AuditLogService auditLogService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.equipmentRepository = equipmentRepository;
        this.equipmentLogRepository = equipmentLogRepository;
        this.stationRegistryService = stationRegistryService;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public EquipmentStatus statusOf(String stationCode) {
        EquipmentStatus status = EquipmentStatus.NORMAL;
        for (Equipment equipment : equipmentRepository.findByStationCodeAndActiveTrueOrderByNameAsc(stationCode)) {
            status = status.worst(equipment.getStatus());
        }
        return status;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, EquipmentStatus> statusByStation() {
        Map<String, EquipmentStatus> result = new HashMap<>();
        for (Equipment equipment : equipmentRepository.findByActiveTrueOrderByStationCodeAscNameAsc()) {
            result.merge(equipment.getStationCode(), equipment.getStatus(), EquipmentStatus::worst);
        }
        return result;
    }

    @Transactional(readOnly = true)
    public List<Equipment> listEquipment(String stationCode) {
        if (stationCode == null || stationCode.isBlank()) {
            return equipmentRepository.findByActiveTrueOrderByStationCodeAscNameAsc();
        }
        return equipmentRepository.findByStationCodeAndActiveTrueOrderByNameAsc(StationRegistryService.normalizeCode(stationCode));
    }

    @Transactional(readOnly = true)
    public List<Equipment> listUnhealthy() {
        List<Equipment> broken = equipmentRepository.findByStatusAndActiveTrueOrderByStationCodeAsc(EquipmentStatus.BROKEN);
        List<Equipment> warning = equipmentRepository.findByStatusAndActiveTrueOrderByStationCodeAsc(EquipmentStatus.WARNING);
        return Stream.concat(broken.stream(), warning.stream()).toList();
    }

    @Transactional(readOnly = true)
    public List<EquipmentLog> listLogs(UUID equipmentId) {
        getEquipment(equipmentId);
        return equipmentLogRepository.findByEquipment_IdOrderByCreatedAtDesc(equipmentId);
    }

    @Transactional(readOnly = true)
    public Equipment getEquipment(UUID equipmentId) {
        return equipmentRepository.findById(equipmentId)
                .orElseThrow(() -> new NotFoundException("EQUIPMENT_NOT_FOUND", "Unknown equipment " + equipmentId));
    }

    public Equipment registerEquipment(String name, String stationCode, String equipmentType, String description, String actorId) {
        String code = stationRegistryService.getStation(stationCode).getCode();
        Equipment equipment = new Equipment();
        equipment.setName(name.trim());
        equipment.setStationCode(code);
        equipment.setEquipmentType(equipmentType);
        equipment.setDescription(description);
        Equipment saved = equipmentRepository.save(equipment);
        equipmentLogRepository.save(new EquipmentLog(
                saved, EquipmentLogAction.REGISTER, null, EquipmentStatus.NORMAL, description, actorId, OffsetDateTime.now(clock)));
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "EQUIPMENT_REGISTER",
                "EQUIPMENT",
                saved.getId().toString(),
                actorId,
                null,
                Map.of("stationCode", code, "name", saved.getName())
        ));
        log.info("Equipment {} registered at station {}", saved.getName(), code);
        return saved;
    }

    public Equipment reportFailure(UUID equipmentId, String description, String actorId) {
        return changeStatus(equipmentId, EquipmentStatus.BROKEN, EquipmentLogAction.REPORT_FAILURE, description, actorId);
    }

    public Equipment reportWarning(UUID equipmentId, String description, String actorId) {
        return changeStatus(equipmentId, EquipmentStatus.WARNING, EquipmentLogAction.REPORT_WARNING, description, actorId);
    }

    public Equipment reportRepair(UUID equipmentId, String description, String actorId) {
        return changeStatus(equipmentId, EquipmentStatus.NORMAL, EquipmentLogAction.REPAIR, description, actorId);
    }

    private Equipment changeStatus(
            UUID equipmentId,
            EquipmentStatus newStatus,
            EquipmentLogAction action,
            String description,
            String actorId
    ) {
        Equipment equipment = getEquipment(equipmentId);
        EquipmentStatus oldStatus = equipment.getStatus();
        OffsetDateTime now = OffsetDateTime.now(clock);
        equipment.setStatus(newStatus);
        Equipment saved = equipmentRepository.save(equipment);
        equipmentLogRepository.save(new EquipmentLog(saved, action, oldStatus, newStatus, description, actorId, now));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("stationCode", saved.getStationCode());
        detail.put("oldStatus", oldStatus.name());
        detail.put("newStatus", newStatus.name());
        if (description != null && !description.isBlank()) {
            detail.put("description", description);
        }
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "EQUIPMENT_" + action.name(),
                "EQUIPMENT",
                saved.getId().toString(),
                actorId,
                null,
                detail
        ));

        if (newStatus != EquipmentStatus.NORMAL) {
            log.warn("Equipment {} at station {} reported {} by {}", saved.getName(), saved.getStationCode(), newStatus, actorId);
            eventPublisher.publishEvent(new EquipmentFailureReportedEvent(
                    saved.getId(),
                    saved.getName(),
                    saved.getStationCode(),
                    newStatus,
                    description,
                    actorId,
                    now
            ));
        } else {
            log.info("Equipment {} at station {} back to NORMAL", saved.getName(), saved.getStationCode());
        }
        return saved;
    }
}
