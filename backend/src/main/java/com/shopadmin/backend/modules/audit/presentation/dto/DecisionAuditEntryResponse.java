package com.shopadmin.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.modules.audit.domain.DecisionOutcome;
import com.shopadmin.backend.modules.audit.domain.PermissionDecisionLog;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.DecisionSource;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

public record DecisionAuditEntryResponse(
        UUID id,
        UUID actorId,
        ResourceType resource,
        ActionType action,
        String resourceId,
        DecisionOutcome decision,
        DecisionSource source,
        String reason,
        boolean infrastructureFailure,
        String clientIp,
        String userAgent,
        String requestId,
        OffsetDateTime decidedAt
) {

    public static DecisionAuditEntryResponse from(PermissionDecisionLog row) {
        return new DecisionAuditEntryResponse(
                row.getId(),
                row.getActorUserId(),
                row.getResourceType(),
                row.getActionType(),
                row.getResourceId(),
                row.getOutcome(),
                row.getSource(),
                row.getReason(),
                row.isInfrastructureFailure(),
                row.getClientIp(),
                row.getUserAgent(),
                row.getRequestId(),
                row.getDecidedAt()
        );
    }
}
