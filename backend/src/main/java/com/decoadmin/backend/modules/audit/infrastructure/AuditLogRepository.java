package com.decoadmin.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.decoadmin.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByActorUserIdOrderByCreatedAtAsc(UUID actorUserId);
}
