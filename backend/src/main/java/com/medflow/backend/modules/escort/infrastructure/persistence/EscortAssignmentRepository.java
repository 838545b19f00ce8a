package com.medflow.backend.modules.escort.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.medflow.backend.modules.escort.domain.EscortAssignment;

public interface EscortAssignmentRepository extends JpaRepository<EscortAssignment, UUID> {

    Optional<EscortAssignment> findByPatientIdAndExamDateAndActiveTrue(UUID patientId, LocalDate examDate);

    List<EscortAssignment> findByStaffIdAndExamDateAndActiveTrue(String staffId, LocalDate examDate);

    List<EscortAssignment> findByPatientIdAndExamDateOrderByAssignedAtDesc(UUID patientId, LocalDate examDate);

    List<EscortAssignment> findByExamDateAndActiveTrueOrderByStaffIdAsc(LocalDate examDate);

    long countByPatientIdAndExamDateAndActiveTrue(UUID patientId, LocalDate examDate);
}
