package com.medflow.backend.modules.escort.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.medflow.backend.modules.escort.domain.EscortStaffSlot;

public interface EscortStaffSlotRepository extends JpaRepository<EscortStaffSlot, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from EscortStaffSlot s where s.staffId = :staffId and s.examDate = :examDate")
    Optional<EscortStaffSlot> findForUpdate(@Param("staffId") String staffId, @Param("examDate") LocalDate examDate);
}
