package com.shopadmin.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.audit.domain.AuditLog;

public record AdminAuditEntryResponse(
        UUID id,
        AdminAuditAction action,
        AdminAuditResource resourceType,
        String resourceKey,
        UUID actorId,
        UUID targetUserId,
        Map<String, Object> detail,
        String clientIp,
        String userAgent,
        String requestId,
        OffsetDateTime createdAt
) {

    public static AdminAuditEntryResponse from(AuditLog log) {
        return new AdminAuditEntryResponse(
                log.getId(),
                log.getActionType(),
                log.getResourceType(),
                log.getResourceKey(),
                log.getActorUserId(),
                log.getTargetUserId(),
                log.getDetail() != null ? log.getDetail() : Map.of(),
                log.getClientIp(),
                log.getUserAgent(),
                log.getRequestId(),
                log.getCreatedAt()
        );
    }
}
