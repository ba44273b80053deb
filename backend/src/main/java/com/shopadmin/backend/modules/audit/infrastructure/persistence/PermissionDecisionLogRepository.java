package com.shopadmin.backend.modules.audit.infrastructure.persistence;

import java.util.UUID;

import com.shopadmin.backend.modules.audit.domain.PermissionDecisionLog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface PermissionDecisionLogRepository
        extends JpaRepository<PermissionDecisionLog, UUID>, JpaSpecificationExecutor<PermissionDecisionLog> {

    long countByActorUserId(UUID actorUserId);
}
