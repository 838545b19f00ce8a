package com.medflow.backend.modules.conflict.application;

import java.util.ArrayList;
import java.util.List;

import com.medflow.backend.modules.conflict.domain.ConflictCheck;
import com.medflow.backend.modules.conflict.domain.ConflictFinding;
import com.medflow.backend.modules.conflict.domain.ConflictReport;
import com.medflow.backend.modules.conflict.domain.ConflictScope;
import com.medflow.backend.modules.conflict.domain.ConflictSeverity;
import com.medflow.backend.modules.conflict.domain.ConflictType;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.occupancy.application.OccupancyThresholds;
import com.medflow.backend.modules.occupancy.domain.OccupancyLevel;

import org.springframework.stereotype.Component;

/**
 * Pre-commit validation of a proposed station. Findings are ordered capacity, equipment, dependency,
 * revisit. Dependency and revisit findings are advisory and never block.
 */
@Component
public class ConflictDetector {

    private final OccupancyThresholds thresholds;

    public ConflictDetector(OccupancyThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public ConflictReport detect(ConflictCheck check, ConflictScope scope) {
        List<ConflictFinding> findings = new ArrayList<>();
        String code = check.stationCode();

        if (check.inExam() >= check.capacity()) {
            findings.add(ConflictFinding.of(ConflictType.CAPACITY, ConflictSeverity.BLOCK, code,
                    "Station " + code + " is full (" + check.inExam() + "/" + check.capacity() + " in exam)"));
        } else if (scope == ConflictScope.ASSIGNMENT
                && thresholds.classify(OccupancyThresholds.utilization(check.inExam(), check.capacity())) == OccupancyLevel.WARNING) {
            findings.add(ConflictFinding.of(ConflictType.CAPACITY, ConflictSeverity.INFO, code,
                    "Station " + code + " is busy (" + check.inExam() + "/" + check.capacity() + " in exam)"));
        }

        if (check.equipmentStatus() == EquipmentStatus.BROKEN) {
            findings.add(ConflictFinding.of(ConflictType.EQUIPMENT, ConflictSeverity.BLOCK, code,
                    "Equipment at station " + code + " is broken"));
        } else if (check.equipmentStatus() == EquipmentStatus.WARNING) {
            findings.add(ConflictFinding.of(ConflictType.EQUIPMENT, ConflictSeverity.WARN, code,
                    "Equipment at station " + code + " reports a warning"));
        }

        if (scope == ConflictScope.ASSIGNMENT) {
            for (String predecessor : unmetPredecessors(check)) {
                findings.add(new ConflictFinding(ConflictType.DEPENDENCY, ConflictSeverity.WARN, code, predecessor,
                        "Recommend completing " + predecessor + " before " + code));
            }
            if (check.completedStationCodes().contains(code)) {
                findings.add(ConflictFinding.of(ConflictType.REVISIT, ConflictSeverity.INFO, code,
                        "Patient already completed " + code));
            } else if (code.equals(check.currentStationCode())) {
                findings.add(ConflictFinding.of(ConflictType.REVISIT, ConflictSeverity.INFO, code,
                        "Patient is already at " + code));
            }
        }
        return new ConflictReport(code, findings);
    }

    /**
     * Predecessors not yet completed. With a booked package only predecessors in that package count.
     */
    public static List<String> unmetPredecessors(ConflictCheck check) {
        List<String> unmet = new ArrayList<>();
        for (String predecessor : check.predecessorCodes()) {
            if (check.completedStationCodes().contains(predecessor)) {
                continue;
            }
            if (!check.requiredStationCodes().isEmpty() && !check.requiredStationCodes().contains(predecessor)) {
                continue;
            }
            unmet.add(predecessor);
        }
        return unmet;
    }
}
