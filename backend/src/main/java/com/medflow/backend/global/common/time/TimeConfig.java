package com.medflow.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides shared time-related beans so modules use a single UTC clock source
 * and one facility time zone for wall-clock rules (exam dates, fasting cutoff).
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public ZoneId facilityZoneId(@Value("${medflow.facility.zone-id:Asia/Taipei}") String zoneId) {
        return ZoneId.of(zoneId);
    }
}
