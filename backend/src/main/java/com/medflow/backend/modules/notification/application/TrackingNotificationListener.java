package com.medflow.backend.modules.notification.application;

import java.util.LinkedHashMap;
import java.util.Map;

import com.medflow.backend.modules.conflict.domain.EquipmentBrokenDetectedEvent;
import com.medflow.backend.modules.equipment.application.EquipmentFailureReportedEvent;
import com.medflow.backend.modules.escort.application.EscortAssignedEvent;
import com.medflow.backend.modules.escort.application.EscortAssignmentService;
import com.medflow.backend.modules.escort.domain.EscortAssignment;
import com.medflow.backend.modules.tracking.application.NextStationAssignedEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns engine events into in-app notifications. Committed changes notify after commit; a broken
 * station found during a rejected assignment still notifies dispatch after the rollback.
 */
@Component
public class TrackingNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(TrackingNotificationListener.class);

    private final NotificationService notificationService;
    private final EscortAssignmentService escortAssignmentService;
    private final boolean notifyOnAssignment;
    private final boolean notifyOnNextStation;
    private final boolean notifyOnEquipmentFailure;
    private final String dispatchRecipient;

    public TrackingNotificationListener(
            NotificationService notificationService,
            EscortAssignmentService escortAssignmentService,
            @Value("${medflow.notification.on-assignment:true}") boolean notifyOnAssignment,
            @Value("${medflow.notification.on-next-station:true}") boolean notifyOnNextStation,
            @Value("${medflow.notification.on-equipment-failure:true}") boolean notifyOnEquipmentFailure,
            @Value("${medflow.notification.dispatch-recipient:DISPATCH}") String dispatchRecipient
    ) {
        this.notificationService = notificationService;
        this.escortAssignmentService = escortAssignmentService;
        this.notifyOnAssignment = notifyOnAssignment;
        this.notifyOnNextStation = notifyOnNextStation;
        this.notifyOnEquipmentFailure = notifyOnEquipmentFailure;
        this.dispatchRecipient = dispatchRecipient;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onEscortAssigned(EscortAssignedEvent event) {
        if (!notifyOnAssignment) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("patientId", event.patientId().toString());
        metadata.put("examDate", event.examDate().toString());
        notificationService.sendNotification(
                event.staffId(),
                NotificationService.KIND_ESCORT_ASSIGNED,
                "New escort assignment",
                "Please escort " + event.patientName() + " (" + event.chartNo() + ")",
                "ESCORT:" + event.assignmentId(),
                metadata,
                NotificationService.DEFAULT_TTL_HOURS
        );
        log.debug("Escort notification queued for {}", event.staffId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onNextStationAssigned(NextStationAssignedEvent event) {
        if (!notifyOnNextStation) {
            return;
        }
        String recipient = escortAssignmentService.getActiveEscort(event.patientId(), event.examDate())
                .map(EscortAssignment::getStaffId)
                .orElse(dispatchRecipient);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("patientId", event.patientId().toString());
        metadata.put("examDate", event.examDate().toString());
        metadata.put("stationCode", event.nextStationCode());
        metadata.put("override", event.override());
        notificationService.sendNotification(
                recipient,
                NotificationService.KIND_NEXT_STATION,
                "Next station: " + event.nextStationCode(),
                event.patientName() + " (" + event.chartNo() + ") should go to " + event.nextStationCode(),
                null,
                metadata,
                NotificationService.DEFAULT_TTL_HOURS
        );
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMPLETION, fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onEquipmentBrokenDetected(EquipmentBrokenDetectedEvent event) {
        if (!notifyOnEquipmentFailure) {
            return;
        }
        notificationService.sendNotification(
                dispatchRecipient,
                NotificationService.KIND_EQUIPMENT_BROKEN,
                "Broken equipment at " + event.stationCode(),
                "An assignment to " + event.stationCode() + " hit broken equipment",
                "BROKEN:" + event.stationCode() + ":" + event.examDate(),
                Map.of("stationCode", event.stationCode(), "requestedBy", String.valueOf(event.requestedBy())),
                NotificationService.DEFAULT_TTL_HOURS
        );
        log.warn("Assignment attempt hit broken equipment at {}", event.stationCode());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onEquipmentFailureReported(EquipmentFailureReportedEvent event) {
        if (!notifyOnEquipmentFailure) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("equipmentId", event.equipmentId().toString());
        metadata.put("stationCode", event.stationCode());
        metadata.put("status", event.newStatus().name());
        notificationService.sendNotification(
                dispatchRecipient,
                NotificationService.KIND_EQUIPMENT_FAILURE,
                event.equipmentName() + " is " + event.newStatus(),
                event.description() != null ? event.description() : "Reported by " + event.reportedBy(),
                null,
                metadata,
                NotificationService.DEFAULT_TTL_HOURS
        );
    }
}
