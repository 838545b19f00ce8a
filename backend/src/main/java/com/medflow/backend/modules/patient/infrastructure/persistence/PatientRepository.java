package com.medflow.backend.modules.patient.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.medflow.backend.modules.patient.domain.Patient;

public interface PatientRepository extends JpaRepository<Patient, UUID> {

    Optional<Patient> findByChartNoAndCheckupDate(String chartNo, LocalDate checkupDate);

    List<Patient> findByCheckupDateOrderByChartNoAsc(LocalDate checkupDate);

    long countByCheckupDateAndActiveTrue(LocalDate checkupDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Patient p where p.id = :id")
    Optional<Patient> findByIdForUpdate(@Param("id") UUID id);
}
