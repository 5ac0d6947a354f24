package com.decoadmin.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.decoadmin.backend.modules.audit.domain.AuditLog;
import com.decoadmin.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    /**
     * Writes in a transaction of its own; a failing audit insert never rolls back the caller.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setCorrelationId(command.correlationId());
        auditLog.setCreatedAt(command.occurredAt());

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            String correlationId,
            Map<String, Object> detail,
            OffsetDateTime occurredAt
    ) {
    }
}
