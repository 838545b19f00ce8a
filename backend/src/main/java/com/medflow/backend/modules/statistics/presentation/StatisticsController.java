package com.medflow.backend.modules.statistics.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.medflow.backend.modules.statistics.application.StatisticsService;
import com.medflow.backend.modules.statistics.domain.ActorActivity;
import com.medflow.backend.modules.statistics.domain.DailySummary;
import com.medflow.backend.modules.statistics.domain.HourlyActivity;
import com.medflow.backend.modules.statistics.domain.StationThroughput;
import com.medflow.backend.modules.tracking.presentation.dto.HistoryEntryResponse;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/statistics")
@Tag(name = "Statistics")
public class StatisticsController {

    private static final int MAX_HISTORY_LIMIT = 500;

    private final StatisticsService statisticsService;

    public StatisticsController(StatisticsService statisticsService) {
        this.statisticsService = statisticsService;
    }

    @GetMapping("/daily")
    public ResponseEntity<DailySummary> daily(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(statisticsService.dailySummary(date));
    }

    @GetMapping("/daily-range")
    public ResponseEntity<List<DailySummary>> dailyRange(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(statisticsService.dailySummaries(from, to));
    }

    @GetMapping("/hourly")
    public ResponseEntity<List<HourlyActivity>> hourly(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(statisticsService.hourlyActivity(date));
    }

    @GetMapping("/stations")
    public ResponseEntity<List<StationThroughput>> stations(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(statisticsService.stationThroughput(date));
    }

    @GetMapping("/actors")
    public ResponseEntity<List<ActorActivity>> actors(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(statisticsService.actorActivity(date));
    }

    @GetMapping("/history")
    public ResponseEntity<List<HistoryEntryResponse>> history(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(name = "patientId", required = false) UUID patientId,
            @RequestParam(name = "stationCode", required = false) String stationCode,
            @RequestParam(name = "limit", defaultValue = "100") int limit
    ) {
        return ResponseEntity.ok(statisticsService.historyRecords(from, to, patientId, stationCode, Math.min(limit, MAX_HISTORY_LIMIT))
                .stream()
                .map(HistoryEntryResponse::from)
                .toList());
    }
}
