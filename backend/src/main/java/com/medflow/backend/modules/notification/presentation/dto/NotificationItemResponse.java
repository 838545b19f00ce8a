package com.medflow.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record NotificationItemResponse(
        UUID id,
        String kindCode,
        String title,
        String body,
        String state,
        OffsetDateTime createdAt,
        OffsetDateTime readAt,
        OffsetDateTime ttlAt,
        Map<String, Object> metadata
) {
}
