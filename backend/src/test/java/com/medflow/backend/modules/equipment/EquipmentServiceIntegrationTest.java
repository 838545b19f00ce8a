package com.medflow.backend.modules.equipment;

import static com.medflow.backend.support.TestFixtures.EXAM_DATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.modules.audit.application.AuditLogService;
import com.medflow.backend.modules.audit.domain.AuditLog;
import com.medflow.backend.modules.conflict.domain.ConflictBlockedException;
import com.medflow.backend.modules.equipment.application.EquipmentService;
import com.medflow.backend.modules.equipment.domain.Equipment;
import com.medflow.backend.modules.equipment.domain.EquipmentLog;
import com.medflow.backend.modules.equipment.domain.EquipmentLogAction;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.notification.application.NotificationService;
import com.medflow.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.medflow.backend.modules.tracking.application.TrackingService;
import com.medflow.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class EquipmentServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private EquipmentService equipmentService;

    @Autowired
    private TrackingService trackingService;

    @Autowired
    private AuditLogService auditLogService;

    @Autowired
    private NotificationRepository notificationRepository;

    @Test
    @DisplayName("a failure report takes the station out of assignment until it is repaired")
    void failureAndRepairCycle() {
        Equipment scanner = equipmentService.listEquipment("CT").get(0);
        UUID patient = fixtures.patient("Q-001", "CT").getId();

        equipmentService.reportFailure(scanner.getId(), "gantry error", "tech-1");

        assertThat(equipmentService.statusOf("CT")).isEqualTo(EquipmentStatus.BROKEN);
        assertThat(equipmentService.listUnhealthy()).extracting(Equipment::getStationCode).containsExactly("CT");
        assertThatThrownBy(() -> trackingService.assignNextStation(patient, EXAM_DATE, "CT", "nurse-1"))
                .isInstanceOf(ConflictBlockedException.class);
        assertThat(notificationRepository.findByRecipientIdAndKindCodeOrderByCreatedAtDesc(
                "DISPATCH", NotificationService.KIND_EQUIPMENT_FAILURE)).hasSize(1);

        equipmentService.reportRepair(scanner.getId(), "replaced board", "tech-1");

        assertThat(equipmentService.statusOf("CT")).isEqualTo(EquipmentStatus.NORMAL);
        assertThat(trackingService.assignNextStation(patient, EXAM_DATE, "CT", "nurse-1").state().getNextStationCode())
                .isEqualTo("CT");
        assertThat(equipmentService.listLogs(scanner.getId()))
                .extracting(EquipmentLog::getAction)
                .containsExactlyInAnyOrder(EquipmentLogAction.REPORT_FAILURE, EquipmentLogAction.REPAIR);
        assertThat(auditLogService.listForResource("EQUIPMENT", scanner.getId().toString()))
                .extracting(AuditLog::getActionType)
                .containsExactlyInAnyOrder("EQUIPMENT_REPORT_FAILURE", "EQUIPMENT_REPAIR");
    }

    @Test
    @DisplayName("the worst status among a station's units wins")
    void worstStatusPerStation() {
        Equipment second = equipmentService.registerEquipment("Backup transducer", "us", "IMAGING", null, "tech-1");
        equipmentService.reportWarning(second.getId(), "noisy image", "tech-1");

        assertThat(second.getStationCode()).isEqualTo("US");
        assertThat(equipmentService.statusOf("US")).isEqualTo(EquipmentStatus.WARNING);
        assertThat(equipmentService.statusByStation()).containsEntry("US", EquipmentStatus.WARNING);
        assertThat(equipmentService.listLogs(second.getId())).hasSize(2);
    }

    @Test
    void unknownEquipmentIsNotFound() {
        assertThatThrownBy(() -> equipmentService.reportFailure(UUID.randomUUID(), null, "tech-1"))
                .isInstanceOf(NotFoundException.class);
    }
}
