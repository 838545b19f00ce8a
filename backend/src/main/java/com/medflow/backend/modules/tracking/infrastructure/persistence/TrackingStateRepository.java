package com.medflow.backend.modules.tracking.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.medflow.backend.modules.tracking.domain.TrackingState;
import com.medflow.backend.modules.tracking.domain.TrackingStatus;

public interface TrackingStateRepository extends JpaRepository<TrackingState, UUID> {

    Optional<TrackingState> findByPatientIdAndExamDate(UUID patientId, LocalDate examDate);

    List<TrackingState> findByExamDateOrderByUpdatedAtDesc(LocalDate examDate);

    List<TrackingState> findByExamDateAndStatusOrderByUpdatedAtAsc(LocalDate examDate, TrackingStatus status);

    long countByExamDateAndCurrentStationCodeAndStatus(LocalDate examDate, String currentStationCode, TrackingStatus status);

    long countByPatientIdAndExamDate(UUID patientId, LocalDate examDate);

    /**
     * FIFO queue of a station: patients waiting there, oldest update first.
     */
    @Query("""
            select t from TrackingState t
            where t.examDate = :examDate
              and t.currentStationCode = :stationCode
              and t.status = com.medflow.backend.modules.tracking.domain.TrackingStatus.WAITING
            order by t.updatedAt asc, t.id asc
            """)
    List<TrackingState> findWaitingQueue(@Param("examDate") LocalDate examDate, @Param("stationCode") String stationCode);

    @Query("""
            select new com.medflow.backend.modules.tracking.infrastructure.persistence.StationStatusCount(
                t.currentStationCode, t.status, count(t))
            from TrackingState t
            where t.examDate = :examDate and t.currentStationCode is not null
            group by t.currentStationCode, t.status
            """)
    List<StationStatusCount> countByStationAndStatus(@Param("examDate") LocalDate examDate);

    @Query("""
            select new com.medflow.backend.modules.tracking.infrastructure.persistence.StationCount(
                t.nextStationCode, count(t))
            from TrackingState t
            where t.examDate = :examDate
              and t.nextStationCode is not null
              and t.status in :statuses
            group by t.nextStationCode
            """)
    List<StationCount> countIncomingByStation(
            @Param("examDate") LocalDate examDate,
            @Param("statuses") Collection<TrackingStatus> statuses
    );
}
