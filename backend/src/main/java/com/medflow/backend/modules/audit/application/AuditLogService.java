package com.medflow.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.medflow.backend.modules.audit.domain.AuditLog;
import com.medflow.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private static final int MAX_PAGE_SIZE = 200;

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    /**
     * Joins the caller's transaction, so an audit entry disappears with a rolled back change.
     */
    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        Map<String, Object> detail = null;
        if (command.detail() != null && !command.detail().isEmpty()) {
            detail = new HashMap<>(command.detail());
        }
        String requestId = command.requestId() != null ? command.requestId() : MDC.get("requestId");

        auditLogRepository.save(new AuditLog(
                command.actionType(),
                command.resourceType(),
                command.resourceKey(),
                command.actorId(),
                requestId,
                detail,
                OffsetDateTime.now(clock)
        ));
    }

    @Transactional(readOnly = true)
    public List<AuditLog> listForResource(String resourceType, String resourceKey) {
        return auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtDesc(resourceType, resourceKey);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> listRecent(String actionType, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_PAGE_SIZE)));
        if (actionType == null || actionType.isBlank()) {
            return auditLogRepository.findAllByOrderByCreatedAtDesc(page);
        }
        return auditLogRepository.findByActionTypeOrderByCreatedAtDesc(actionType.trim(), page);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            String actorId,
            String requestId,
            Map<String, Object> detail
    ) {
    }
}
