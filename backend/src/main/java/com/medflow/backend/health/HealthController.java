package com.medflow.backend.health;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medflow.backend.modules.station.infrastructure.persistence.StationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness checks for the deployment platform.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final StationRepository stationRepository;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, StationRepository stationRepository, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.stationRepository = stationRepository;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", OffsetDateTime.now(clock).toString(), null);
    }

    /**
     * Ready once the database answers and the station catalog has been seeded.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String timestamp = OffsetDateTime.now(clock).toString();
        try {
            HealthComponent health = healthEndpoint.health();
            String status = health.getStatus().getCode();
            if (health instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
            long activeStations = stationRepository.countByActiveTrue();
            if (activeStations == 0) {
                status = "DOWN";
            }
            HttpStatus httpStatus = "UP".equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
            return ResponseEntity.status(httpStatus).body(new HealthResponse(status, timestamp, activeStations));
        } catch (RuntimeException e) {
            log.warn("Readiness check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new HealthResponse("DOWN", timestamp, null));
        }
    }

    public record HealthResponse(
            String status,
            String timestamp,
            Long activeStations
    ) {
    }
}
