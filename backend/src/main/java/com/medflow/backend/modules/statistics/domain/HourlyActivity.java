package com.medflow.backend.modules.statistics.domain;

public record HourlyActivity(int hour, String label, long started, long completed) {
}
