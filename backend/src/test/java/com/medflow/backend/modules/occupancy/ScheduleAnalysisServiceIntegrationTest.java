package com.medflow.backend.modules.occupancy;

import static com.medflow.backend.support.TestFixtures.EXAM_DATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import com.medflow.backend.modules.occupancy.application.ScheduleAnalysisService;
import com.medflow.backend.modules.occupancy.domain.Bottleneck;
import com.medflow.backend.modules.occupancy.domain.BottleneckSeverity;
import com.medflow.backend.modules.occupancy.domain.ScheduleAnalysis;
import com.medflow.backend.modules.occupancy.domain.StationDemand;
import com.medflow.backend.modules.patient.application.PatientService;
import com.medflow.backend.modules.tracking.application.TrackingService;
import com.medflow.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;

@AutoConfigureMockMvc
class ScheduleAnalysisServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private ScheduleAnalysisService scheduleAnalysisService;

    @Autowired
    private TrackingService trackingService;

    @Autowired
    private PatientService patientService;

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("stations whose remaining load exceeds two hours are bottlenecks, most loaded first")
    void bottlenecksAreRankedBySeverity() {
        UUID first = fixtures.patient("S-001", "XRAY", "CT", "MRI").getId();
        for (int i = 2; i <= 5; i++) {
            fixtures.patient("S-00" + i, "XRAY", "CT", "MRI");
        }
        trackingService.reportArrival(first, EXAM_DATE, "XRAY", "nurse-1");
        trackingService.reportStart(first, EXAM_DATE, "nurse-1");
        trackingService.reportComplete(first, EXAM_DATE, "nurse-1", null);
        UUID inactive = fixtures.patient("S-009", "CT").getId();
        patientService.setActive(inactive, false, "admin");

        Instant before = Instant.now();
        ScheduleAnalysis analysis = scheduleAnalysisService.analyze(EXAM_DATE);
        Instant after = Instant.now();

        assertThat(analysis.totalPatients()).isEqualTo(5);
        StationDemand xray = analysis.station("XRAY").orElseThrow();
        assertThat(xray.required()).isEqualTo(5);
        assertThat(xray.completed()).isEqualTo(1);
        assertThat(xray.remaining()).isEqualTo(4);
        assertThat(xray.estimatedMinutes()).isEqualTo(20);
        assertThat(analysis.station("CT").orElseThrow().estimatedMinutes()).isEqualTo(150);
        assertThat(analysis.station("REG").orElseThrow().required()).isZero();

        assertThat(analysis.bottlenecks())
                .extracting(Bottleneck::stationCode, Bottleneck::estimatedMinutes, Bottleneck::severity)
                .containsExactly(
                        tuple("MRI", 225L, BottleneckSeverity.HIGH),
                        tuple("CT", 150L, BottleneckSeverity.MEDIUM)
                );
        assertThat(analysis.estimatedCompletion().toInstant())
                .isBetween(before.plus(225, ChronoUnit.MINUTES).truncatedTo(ChronoUnit.SECONDS),
                        after.plus(226, ChronoUnit.MINUTES));
    }

    @Test
    @DisplayName("a load of exactly two hours is not a bottleneck")
    void thresholdIsExclusive() {
        for (int i = 1; i <= 4; i++) {
            fixtures.patient("S-10" + i, "CT");
        }

        ScheduleAnalysis analysis = scheduleAnalysisService.analyze(EXAM_DATE);

        assertThat(analysis.station("CT").orElseThrow().estimatedMinutes()).isEqualTo(120);
        assertThat(analysis.bottlenecks()).isEmpty();
    }

    @Test
    @DisplayName("an empty package counts toward every active station")
    void emptyPackageNeedsEveryStation() {
        fixtures.patient("S-201");

        ScheduleAnalysis analysis = scheduleAnalysisService.analyze(EXAM_DATE);

        assertThat(analysis.stations()).hasSize(10).allSatisfy(demand -> assertThat(demand.required()).isEqualTo(1));
    }

    @Test
    @DisplayName("no completion time is estimated once every exam is done")
    void finishedDayHasNoCompletionTime() {
        UUID id = fixtures.patient("S-301", "XRAY").getId();
        trackingService.reportArrival(id, EXAM_DATE, "XRAY", "nurse-1");
        trackingService.reportStart(id, EXAM_DATE, "nurse-1");
        trackingService.reportComplete(id, EXAM_DATE, "nurse-1", null);

        ScheduleAnalysis analysis = scheduleAnalysisService.analyze(EXAM_DATE);

        assertThat(analysis.station("XRAY").orElseThrow().remaining()).isZero();
        assertThat(analysis.estimatedCompletion()).isNull();
    }

    @Test
    @DisplayName("the analysis endpoint reports demand and bottlenecks")
    void endpoint() throws Exception {
        for (int i = 1; i <= 3; i++) {
            fixtures.patient("S-40" + i, "MRI");
        }

        mockMvc.perform(get("/occupancy/schedule-analysis").param("date", EXAM_DATE.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPatients").value(3))
                .andExpect(jsonPath("$.bottlenecks[0].stationCode").value("MRI"))
                .andExpect(jsonPath("$.bottlenecks[0].estimatedMinutes").value(135))
                .andExpect(jsonPath("$.bottlenecks[0].severity").value("MEDIUM"))
                .andExpect(jsonPath("$.estimatedCompletion").exists());
    }
}
