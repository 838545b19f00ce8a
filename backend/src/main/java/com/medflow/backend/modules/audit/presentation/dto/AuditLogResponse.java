package com.medflow.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medflow.backend.modules.audit.domain.AuditLog;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogResponse(
        UUID auditId,
        String actionType,
        String resourceType,
        String resourceKey,
        String actorId,
        String requestId,
        Map<String, Object> detail,
        OffsetDateTime createdAt
) {

    public static AuditLogResponse from(AuditLog log) {
        return new AuditLogResponse(
                log.getId(),
                log.getActionType(),
                log.getResourceType(),
                log.getResourceKey(),
                log.getActorId(),
                log.getRequestId(),
                log.getDetail(),
                log.getCreatedAt()
        );
    }
}
