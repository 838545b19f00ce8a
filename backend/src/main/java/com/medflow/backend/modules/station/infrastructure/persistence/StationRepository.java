package com.medflow.backend.modules.station.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.medflow.backend.modules.station.domain.Station;

public interface StationRepository extends JpaRepository<Station, UUID> {

    Optional<Station> findByCode(String code);

    List<Station> findByActiveTrueOrderByCodeAsc();

    List<Station> findAllByOrderByCodeAsc();

    long countByActiveTrue();

    /**
     * Station row lock used to serialize capacity-gated transitions (exam start) per station.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Station s where s.code = :code")
    Optional<Station> findByCodeForUpdate(@Param("code") String code);
}
