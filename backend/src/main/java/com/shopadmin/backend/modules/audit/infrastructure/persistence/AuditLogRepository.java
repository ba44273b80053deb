package com.shopadmin.backend.modules.audit.infrastructure.persistence;

import java.util.UUID;

import com.shopadmin.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID>, JpaSpecificationExecutor<AuditLog> {
}
