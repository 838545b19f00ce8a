package com.medflow.backend.modules.tracking.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.medflow.backend.modules.tracking.domain.TrackingAction;
import com.medflow.backend.modules.tracking.domain.TrackingHistory;

public interface TrackingHistoryRepository extends JpaRepository<TrackingHistory, Long> {

    List<TrackingHistory> findByPatientIdAndExamDateOrderByIdDesc(UUID patientId, LocalDate examDate);

    List<TrackingHistory> findByExamDateOrderByIdAsc(LocalDate examDate);

    long countByPatientIdAndExamDate(UUID patientId, LocalDate examDate);

    @Query("""
            select distinct h.stationCode from TrackingHistory h
            where h.patientId = :patientId
              and h.examDate = :examDate
              and h.action = :action
              and h.stationCode is not null
            """)
    List<String> findStationCodes(
            @Param("patientId") UUID patientId,
            @Param("examDate") LocalDate examDate,
            @Param("action") TrackingAction action
    );

    @Query("""
            select h from TrackingHistory h
            where h.stationCode = :stationCode
              and h.examDate between :from and :to
              and h.action in :actions
            order by h.id asc
            """)
    List<TrackingHistory> findStationEntries(
            @Param("stationCode") String stationCode,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to,
            @Param("actions") Collection<TrackingAction> actions
    );

    @Query("""
            select h from TrackingHistory h
            where h.examDate between :from and :to
            order by h.id asc
            """)
    List<TrackingHistory> findBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
