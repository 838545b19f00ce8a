package com.medflow.backend.modules.station.application;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.global.error.ProblemException;
import com.medflow.backend.modules.audit.application.AuditLogService;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.station.infrastructure.persistence.StationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Catalog of examination stations. Mutations here are administrative and audited.
 */
@Service
@Transactional
public class StationRegistryService {

    private static final Logger log = LoggerFactory.getLogger(StationRegistryService.class);

    private final StationRepository stationRepository;
    private final AuditLogService auditLogService;

    public StationRegistryService(StationRepository stationRepository, AuditLogService auditLogService) {
        this.stationRepository = stationRepository;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<Station> listStations(boolean includeInactive) {
        return includeInactive
                ? stationRepository.findAllByOrderByCodeAsc()
                : stationRepository.findByActiveTrueOrderByCodeAsc();
    }

    @Transactional(readOnly = true)
    public Map<String, Station> activeStationsByCode() {
        return stationRepository.findByActiveTrueOrderByCodeAsc().stream()
                .collect(Collectors.toMap(Station::getCode, Function.identity()));
    }

    @Transactional(readOnly = true)
    public Station getStation(String code) {
        return stationRepository.findByCode(normalizeCode(code))
                .orElseThrow(() -> NotFoundException.station(code));
    }

    public Station createStation(StationDefinition definition, String actorId) {
        String code = normalizeCode(definition.code());
        if (stationRepository.findByCode(code).isPresent()) {
            throw new ProblemException(HttpStatus.CONFLICT, "STATION_CODE_TAKEN", "Station " + code + " already exists");
        }
        Station station = new Station();
        station.setCode(code);
        apply(station, definition);
        Station saved = stationRepository.save(station);
        log.info("Station {} registered with capacity {}", code, saved.getCapacity());
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "STATION_CREATE",
                "STATION",
                code,
                actorId,
                null,
                Map.of("capacity", saved.getCapacity(), "predecessors", List.copyOf(saved.getPredecessorCodes()))
        ));
        return saved;
    }

    public Station updateStation(String code, StationDefinition definition, String actorId) {
        Station station = stationRepository.findByCodeForUpdate(normalizeCode(code))
                .orElseThrow(() -> NotFoundException.station(code));
        int previousCapacity = station.getCapacity();
        boolean previouslyActive = station.isActive();
        apply(station, definition);
        Station saved = stationRepository.save(station);
        log.info("Station {} updated: capacity {} -> {}, active {} -> {}",
                saved.getCode(), previousCapacity, saved.getCapacity(), previouslyActive, saved.isActive());
        auditLogService.record(new AuditLogService.AuditLogCommand(
                "STATION_UPDATE",
                "STATION",
                saved.getCode(),
                actorId,
                null,
                Map.of(
                        "previousCapacity", previousCapacity,
                        "capacity", saved.getCapacity(),
                        "active", saved.isActive(),
                        "predecessors", List.copyOf(saved.getPredecessorCodes())
                )
        ));
        return saved;
    }

    private void apply(Station station, StationDefinition definition) {
        if (definition.name() != null && !definition.name().isBlank()) {
            station.setName(definition.name().trim());
        }
        if (station.getName() == null) {
            station.setName(station.getCode());
        }
        if (definition.location() != null) {
            station.setLocation(definition.location().trim());
        }
        if (definition.durationMinutes() != null) {
            if (definition.durationMinutes() < 1) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_DURATION", "duration must be >= 1 minute");
            }
            station.setDurationMinutes(definition.durationMinutes());
        }
        if (definition.capacity() != null) {
            if (definition.capacity() < 1) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_CAPACITY", "capacity must be >= 1");
            }
            station.setCapacity(definition.capacity());
        }
        if (definition.active() != null) {
            station.setActive(definition.active());
        }
        if (definition.fastingPreferred() != null) {
            station.setFastingPreferred(definition.fastingPreferred());
        }
        if (definition.predecessorCodes() != null) {
            station.replacePredecessorCodes(definition.predecessorCodes());
        }
    }

    public static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("station code must not be blank");
        }
        return code.trim().toUpperCase();
    }

    /**
     * Partial station definition; null fields keep their current value.
     */
    public record StationDefinition(
            String code,
            String name,
            String location,
            Integer durationMinutes,
            Integer capacity,
            Boolean active,
            Boolean fastingPreferred,
            List<String> predecessorCodes
    ) {
    }
}
