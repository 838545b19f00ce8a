package com.medflow.backend.modules.audit.presentation;

import java.util.List;

import com.medflow.backend.modules.audit.application.AuditLogService;
import com.medflow.backend.modules.audit.presentation.dto.AuditLogResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/audit-logs")
@Tag(name = "Audit")
public class AuditLogController {

    private final AuditLogService auditLogService;

    public AuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @GetMapping
    @Operation(summary = "Recent audit entries, optionally filtered by action or resource")
    public ResponseEntity<List<AuditLogResponse>> list(
            @RequestParam(name = "actionType", required = false) String actionType,
            @RequestParam(name = "resourceType", required = false) String resourceType,
            @RequestParam(name = "resourceKey", required = false) String resourceKey,
            @RequestParam(name = "limit", defaultValue = "50") int limit
    ) {
        List<AuditLogResponse> body;
        if (resourceType != null && resourceKey != null) {
            body = auditLogService.listForResource(resourceType, resourceKey).stream()
                    .map(AuditLogResponse::from)
                    .toList();
        } else {
            body = auditLogService.listRecent(actionType, limit).stream()
                    .map(AuditLogResponse::from)
                    .toList();
        }
        return ResponseEntity.ok(body);
    }
}
