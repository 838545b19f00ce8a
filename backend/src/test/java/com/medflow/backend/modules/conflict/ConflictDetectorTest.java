package com.medflow.backend.modules.conflict;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;

import com.medflow.backend.modules.conflict.application.ConflictDetector;
import com.medflow.backend.modules.conflict.domain.ConflictCheck;
import com.medflow.backend.modules.conflict.domain.ConflictFinding;
import com.medflow.backend.modules.conflict.domain.ConflictReport;
import com.medflow.backend.modules.conflict.domain.ConflictScope;
import com.medflow.backend.modules.conflict.domain.ConflictSeverity;
import com.medflow.backend.modules.conflict.domain.ConflictType;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.occupancy.application.OccupancyThresholds;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector(new OccupancyThresholds(0.70, 1.0));

    @Test
    @DisplayName("a full station blocks with a capacity finding")
    void fullStationBlocks() {
        ConflictReport report = detector.detect(
                new ConflictCheck("CT", 1, 1, EquipmentStatus.NORMAL, List.of(), Set.of(), List.of()),
                ConflictScope.ASSIGNMENT
        );

        assertThat(report.hasBlocking()).isTrue();
        assertThat(report.hasBlocking(ConflictType.CAPACITY)).isTrue();
        assertThat(report.findings()).singleElement()
                .satisfies(finding -> assertThat(finding.message()).contains("1/1"));
    }

    @Test
    @DisplayName("a busy station is reported for assignments only")
    void busyStationIsInformational() {
        ConflictCheck check = new ConflictCheck("PHY", 10, 8, EquipmentStatus.NORMAL, null, null, null);

        ConflictReport assignment = detector.detect(check, ConflictScope.ASSIGNMENT);
        ConflictReport start = detector.detect(check, ConflictScope.EXAM_START);

        assertThat(assignment.findings()).extracting(ConflictFinding::severity).containsExactly(ConflictSeverity.INFO);
        assertThat(assignment.hasBlocking()).isFalse();
        assertThat(start.findings()).isEmpty();
    }

    @Test
    void equipmentStatusMapsToSeverity() {
        ConflictReport broken = detector.detect(
                new ConflictCheck("MRI", 1, 0, EquipmentStatus.BROKEN, null, null, null), ConflictScope.EXAM_START);
        ConflictReport warning = detector.detect(
                new ConflictCheck("MRI", 1, 0, EquipmentStatus.WARNING, null, null, null), ConflictScope.EXAM_START);

        assertThat(broken.hasBlocking(ConflictType.EQUIPMENT)).isTrue();
        assertThat(warning.hasBlocking()).isFalse();
        assertThat(warning.ofType(ConflictType.EQUIPMENT)).extracting(ConflictFinding::severity)
                .containsExactly(ConflictSeverity.WARN);
    }

    @Test
    @DisplayName("open predecessors warn without blocking and name the predecessor")
    void dependencyWarnings() {
        ConflictReport report = detector.detect(
                new ConflictCheck("CT", 1, 0, EquipmentStatus.NORMAL, List.of("BLOOD", "US"), Set.of("US"), List.of()),
                ConflictScope.ASSIGNMENT
        );

        assertThat(report.hasBlocking()).isFalse();
        assertThat(report.ofType(ConflictType.DEPENDENCY))
                .extracting(ConflictFinding::relatedStationCode)
                .containsExactly("BLOOD");
    }

    @Test
    @DisplayName("predecessors outside a booked package are ignored")
    void dependencyOutsidePackageIgnored() {
        ConflictCheck check = new ConflictCheck(
                "CT", 1, 0, EquipmentStatus.NORMAL,
                List.of("BLOOD", "US"),
                Set.of(),
                List.of("BLOOD", "CT")
        );

        assertThat(ConflictDetector.unmetPredecessors(check)).containsExactly("BLOOD");
        assertThat(detector.detect(check, ConflictScope.EXAM_START).ofType(ConflictType.DEPENDENCY)).isEmpty();
    }

    @Test
    void findingsAreOrderedByType() {
        ConflictReport report = detector.detect(
                new ConflictCheck("ENDO", 2, 2, EquipmentStatus.BROKEN, List.of("BLOOD"), Set.of(), List.of()),
                ConflictScope.ASSIGNMENT
        );

        assertThat(report.findings()).extracting(ConflictFinding::type)
                .containsExactly(ConflictType.CAPACITY, ConflictType.EQUIPMENT, ConflictType.DEPENDENCY);
    }

    @Test
    @DisplayName("a completed or current station is reported back as an info finding")
    void revisitIsReported() {
        ConflictReport completed = detector.detect(
                new ConflictCheck("BLOOD", 4, 0, EquipmentStatus.NORMAL, List.of(), Set.of("BLOOD"), List.of("BLOOD", "XRAY"), "XRAY"),
                ConflictScope.ASSIGNMENT
        );
        ConflictReport current = detector.detect(
                new ConflictCheck("XRAY", 2, 0, EquipmentStatus.NORMAL, List.of(), Set.of("BLOOD"), List.of("BLOOD", "XRAY"), "XRAY"),
                ConflictScope.ASSIGNMENT
        );

        assertThat(completed.hasBlocking()).isFalse();
        assertThat(completed.ofType(ConflictType.REVISIT)).singleElement()
                .satisfies(finding -> {
                    assertThat(finding.severity()).isEqualTo(ConflictSeverity.INFO);
                    assertThat(finding.message()).contains("already completed");
                });
        assertThat(current.ofType(ConflictType.REVISIT)).extracting(ConflictFinding::message)
                .containsExactly("Patient is already at XRAY");
        assertThat(detector.detect(
                new ConflictCheck("BLOOD", 4, 0, EquipmentStatus.NORMAL, List.of(), Set.of("BLOOD"), List.of(), null),
                ConflictScope.EXAM_START).findings()).isEmpty();
    }
}
