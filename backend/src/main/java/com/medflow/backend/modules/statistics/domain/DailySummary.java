package com.medflow.backend.modules.statistics.domain;

import java.time.LocalDate;

public record DailySummary(
        LocalDate date,
        long totalPatients,
        long completed,
        long inProgress,
        long notStarted,
        double completionRate,
        long totalEquipment,
        long brokenEquipment,
        long historyEntries
) {
}
