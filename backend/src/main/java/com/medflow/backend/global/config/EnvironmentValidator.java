package com.medflow.backend.global.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "medflow.facility.zone-id",
            "medflow.occupancy.warning-utilization",
            "medflow.occupancy.full-utilization"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingKeys = new ArrayList<>();
        List<String> invalidKeys = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missingKeys.add(key);
            }
        }

        Optional.ofNullable(environment.getProperty("medflow.facility.zone-id")).ifPresent(zone -> {
            try {
                ZoneId.of(zone.trim());
            } catch (DateTimeException ex) {
                invalidKeys.add("medflow.facility.zone-id: unknown zone " + zone);
            }
        });

        Double warning = readRatio("medflow.occupancy.warning-utilization", invalidKeys);
        Double full = readRatio("medflow.occupancy.full-utilization", invalidKeys);
        if (warning != null && full != null && warning > full) {
            invalidKeys.add("medflow.occupancy.warning-utilization must not exceed full-utilization");
        }

        Optional.ofNullable(environment.getProperty("medflow.recommendation.fasting-cutoff-hour")).ifPresent(hour -> {
            try {
                int parsed = Integer.parseInt(hour.trim());
                if (parsed < 0 || parsed > 23) {
                    invalidKeys.add("medflow.recommendation.fasting-cutoff-hour: must be 0-23");
                }
            } catch (NumberFormatException ex) {
                invalidKeys.add("medflow.recommendation.fasting-cutoff-hour: must be a number");
            }
        });

        if (!missingKeys.isEmpty() || !invalidKeys.isEmpty()) {
            if (!missingKeys.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missingKeys));
            }
            invalidKeys.forEach(problem -> log.error("Invalid setting: {}", problem));
            throw new IllegalStateException("Environment validation failed; see log for details");
        }

        log.info("Environment validation passed");
    }

    private Double readRatio(String key, List<String> invalidKeys) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value <= 0) {
                invalidKeys.add(key + ": must be positive");
                return null;
            }
            return value;
        } catch (NumberFormatException ex) {
            invalidKeys.add(key + ": must be a number");
            return null;
        }
    }
}
