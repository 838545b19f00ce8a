package com.medflow.backend.modules.occupancy.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.medflow.backend.modules.station.application.StationRegistryService;
import com.medflow.backend.modules.tracking.domain.TrackingAction;
import com.medflow.backend.modules.tracking.domain.TrackingHistory;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingHistoryRepository;
import com.medflow.backend.modules.tracking.infrastructure.persistence.TrackingStateRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WaitTimeEstimatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);
    private static final OffsetDateTime NINE = OffsetDateTime.parse("2025-03-10T09:00:00Z");

    @Mock
    private TrackingHistoryRepository trackingHistoryRepository;

    @Mock
    private TrackingStateRepository trackingStateRepository;

    @Mock
    private StationRegistryService stationRegistryService;

    @Mock
    private OccupancyService occupancyService;

    private WaitTimeEstimator estimator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NINE.toInstant(), ZoneOffset.UTC);
        estimator = new WaitTimeEstimator(
                trackingHistoryRepository,
                trackingStateRepository,
                stationRegistryService,
                occupancyService,
                clock,
                7
        );
    }

    @Test
    @DisplayName("queue wait is one duration per patient ahead plus half a duration for the running exam")
    void waitMinutesFormula() {
        assertThat(WaitTimeEstimator.waitMinutes(0, 0, 20)).isZero();
        assertThat(WaitTimeEstimator.waitMinutes(3, 0, 20)).isEqualTo(60);
        assertThat(WaitTimeEstimator.waitMinutes(3, 1, 20)).isEqualTo(70);
        assertThat(WaitTimeEstimator.waitMinutes(0, 2, 15)).isEqualTo(7);
    }

    @Test
    @DisplayName("average duration pairs starts with completes and drops implausible exams")
    void averageDurationFromHistory() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        UUID stuck = UUID.randomUUID();
        when(trackingHistoryRepository.findStationEntries(eq("US"), eq(DAY.minusDays(7)), eq(DAY), anyCollection()))
                .thenReturn(List.of(
                        entry(first, TrackingAction.START, NINE),
                        entry(second, TrackingAction.START, NINE.plusMinutes(5)),
                        entry(first, TrackingAction.COMPLETE, NINE.plusMinutes(20)),
                        entry(second, TrackingAction.COMPLETE, NINE.plusMinutes(35)),
                        entry(stuck, TrackingAction.START, NINE.minusHours(5)),
                        entry(stuck, TrackingAction.COMPLETE, NINE)
                ));

        assertThat(estimator.averageDurationMinutes("US", DAY)).hasValue(25);
    }

    @Test
    void averageDurationEmptyWithoutPairs() {
        when(trackingHistoryRepository.findStationEntries(any(), any(), any(), anyCollection()))
                .thenReturn(List.of(entry(UUID.randomUUID(), TrackingAction.COMPLETE, NINE)));

        assertThat(estimator.averageDurationMinutes("CT", DAY)).isEmpty();
    }

    private static TrackingHistory entry(UUID patientId, TrackingAction action, OffsetDateTime at) {
        TrackingStatus status = action == TrackingAction.START ? TrackingStatus.IN_EXAM : TrackingStatus.MOVING;
        return new TrackingHistory(patientId, DAY, "US", status, action, at, "nurse-1", null);
    }
}
