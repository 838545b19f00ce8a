package com.medflow.backend.modules.statistics.domain;

public record ActorActivity(
        String actorId,
        long operations,
        long arrivals,
        long starts,
        long completions,
        long assignments
) {
}
