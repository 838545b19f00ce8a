package com.medflow.backend.modules.escort;

import static com.medflow.backend.support.TestFixtures.EXAM_DATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.medflow.backend.global.error.ConcurrencyConflictException;
import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.modules.escort.application.EscortAssignmentService;
import com.medflow.backend.modules.escort.domain.EscortAssignment;
import com.medflow.backend.modules.escort.infrastructure.persistence.EscortAssignmentRepository;
import com.medflow.backend.modules.notification.application.NotificationService;
import com.medflow.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.medflow.backend.modules.tracking.application.TrackingService;
import com.medflow.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class EscortAssignmentServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private EscortAssignmentService escortAssignmentService;

    @Autowired
    private EscortAssignmentRepository escortAssignmentRepository;

    @Autowired
    private TrackingService trackingService;

    @Autowired
    private NotificationRepository notificationRepository;

    @Test
    @DisplayName("reassigning a patient releases the previous escort")
    void reassignmentReleasesPrevious() {
        UUID id = fixtures.patient("E-001", "PHY").getId();

        escortAssignmentService.assignEscort(id, EXAM_DATE, "staff-a", "dispatcher");
        EscortAssignment second = escortAssignmentService.assignEscort(id, EXAM_DATE, "staff-b", "dispatcher");

        assertThat(escortAssignmentService.getActiveEscort(id, EXAM_DATE))
                .get()
                .extracting(EscortAssignment::getStaffId)
                .isEqualTo("staff-b");
        List<EscortAssignment> history = escortAssignmentService.getAssignmentHistory(id, EXAM_DATE);
        assertThat(history).hasSize(2);
        assertThat(history).filteredOn(EscortAssignment::isActive).singleElement()
                .extracting(EscortAssignment::getId)
                .isEqualTo(second.getId());
    }

    @Test
    void assigningTheSameStaffTwiceIsIdempotent() {
        UUID id = fixtures.patient("E-002", "PHY").getId();

        EscortAssignment first = escortAssignmentService.assignEscort(id, EXAM_DATE, "staff-a", "dispatcher");
        EscortAssignment again = escortAssignmentService.assignEscort(id, EXAM_DATE, " staff-a ", "dispatcher");

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(escortAssignmentService.getAssignmentHistory(id, EXAM_DATE)).hasSize(1);
    }

    @Test
    @DisplayName("a staff member escorts one patient at a time")
    void staffMovesToNewPatient() {
        UUID first = fixtures.patient("E-003", "PHY").getId();
        UUID second = fixtures.patient("E-004", "PHY").getId();

        escortAssignmentService.assignEscort(first, EXAM_DATE, "staff-a", "dispatcher");
        escortAssignmentService.assignEscort(second, EXAM_DATE, "staff-a", "dispatcher");

        assertThat(escortAssignmentService.getActiveEscort(first, EXAM_DATE)).isEmpty();
        assertThat(escortAssignmentService.getActiveAssignmentOfStaff("staff-a", EXAM_DATE))
                .get()
                .extracting(EscortAssignment::getPatientId)
                .isEqualTo(second);
    }

    @Test
    void releaseWithoutEscortIsNotFound() {
        UUID id = fixtures.patient("E-005", "PHY").getId();

        assertThatThrownBy(() -> escortAssignmentService.releaseEscort(id, EXAM_DATE, "dispatcher"))
                .isInstanceOf(NotFoundException.class);

        escortAssignmentService.assignEscort(id, EXAM_DATE, "staff-a", "dispatcher");
        EscortAssignment released = escortAssignmentService.releaseEscort(id, EXAM_DATE, "dispatcher");

        assertThat(released.isActive()).isFalse();
        assertThat(released.getReleasedBy()).isEqualTo("dispatcher");
        assertThat(escortAssignmentService.listActive(EXAM_DATE)).isEmpty();
    }

    @Test
    @DisplayName("next-station notices go to the active escort instead of dispatch")
    void nextStationNotifiesEscort() {
        UUID id = fixtures.patient("E-006", "PHY", "XRAY").getId();
        escortAssignmentService.assignEscort(id, EXAM_DATE, "staff-a", "dispatcher");

        trackingService.assignNextStation(id, EXAM_DATE, "XRAY", "nurse-1");

        assertThat(notificationRepository.findByRecipientIdAndKindCodeOrderByCreatedAtDesc(
                "staff-a", NotificationService.KIND_ESCORT_ASSIGNED)).hasSize(1);
        assertThat(notificationRepository.findByRecipientIdAndKindCodeOrderByCreatedAtDesc(
                "staff-a", NotificationService.KIND_NEXT_STATION)).hasSize(1);
        assertThat(notificationRepository.findByRecipientIdAndKindCodeOrderByCreatedAtDesc(
                "DISPATCH", NotificationService.KIND_NEXT_STATION)).isEmpty();
    }

    @Test
    @DisplayName("concurrent assignments for one patient leave a single active escort")
    void concurrentAssignmentsKeepOneActive() throws Exception {
        UUID id = fixtures.patient("E-007", "PHY").getId();
        int workers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String staff = "staff-" + i;
                futures.add(executor.submit(() -> {
                    go.await();
                    try {
                        escortAssignmentService.assignEscort(id, EXAM_DATE, staff, "dispatcher");
                    } catch (RuntimeException ex) {
                        // a lock timeout is an acceptable outcome here
                        return ex;
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(escortAssignmentRepository.countByPatientIdAndExamDateAndActiveTrue(id, EXAM_DATE)).isEqualTo(1);
    }

    @Test
    @DisplayName("two patients racing for one staff member leave the staff member on exactly one of them")
    void concurrentAssignmentsOfOneStaffMember() throws Exception {
        UUID first = fixtures.patient("E-008", "PHY").getId();
        UUID second = fixtures.patient("E-009", "PHY").getId();

        for (int round = 0; round < 10; round++) {
            String staff = "staff-race-" + round;
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<RuntimeException>> futures = new ArrayList<>();
            try {
                for (UUID patientId : List.of(first, second)) {
                    futures.add(executor.submit(() -> {
                        go.await();
                        try {
                            escortAssignmentService.assignEscort(patientId, EXAM_DATE, staff, "dispatcher");
                            return null;
                        } catch (RuntimeException ex) {
                            return ex;
                        }
                    }));
                }
                go.countDown();
                List<RuntimeException> errors = new ArrayList<>();
                for (Future<RuntimeException> future : futures) {
                    RuntimeException error = future.get(60, TimeUnit.SECONDS);
                    if (error != null) {
                        errors.add(error);
                    }
                }
                assertThat(errors).hasSizeLessThan(2)
                        .allSatisfy(error -> assertThat(error).isInstanceOf(ConcurrencyConflictException.class));
            } finally {
                executor.shutdownNow();
            }

            List<EscortAssignment> active = escortAssignmentRepository.findByStaffIdAndExamDateAndActiveTrue(staff, EXAM_DATE);
            assertThat(active).as("round %d", round).hasSize(1);
            assertThat(active.get(0).getPatientId()).isIn(first, second);
        }
    }

    @Test
    void assignmentOnAnotherDateIsNotFound() {
        UUID id = fixtures.patient("E-010", "PHY").getId();

        assertThatThrownBy(() -> escortAssignmentService.assignEscort(id, EXAM_DATE.plusDays(1), "staff-a", "dispatcher"))
                .isInstanceOf(NotFoundException.class)
                .satisfies(ex -> assertThat(((NotFoundException) ex).getCode()).isEqualTo("PATIENT_DATE_NOT_FOUND"));
        assertThat(escortAssignmentService.getActiveAssignmentOfStaff("staff-a", EXAM_DATE.plusDays(1))).isEmpty();
    }
}
