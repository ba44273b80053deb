package com.shopadmin.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.shopadmin.backend.global.web.ClientRequestContext;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.DecisionSource;
import com.shopadmin.backend.modules.permission.domain.PermissionDecision;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

public record DecisionAuditEntry(
        UUID actorId,
        ResourceType resourceType,
        ActionType actionType,
        String resourceId,
        boolean allowed,
        DecisionSource source,
        String reason,
        boolean infrastructureFailure,
        ClientRequestContext request,
        OffsetDateTime decidedAt
) {

    public DecisionAuditEntry {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(decidedAt, "decidedAt");
        request = request != null ? request : ClientRequestContext.empty();
    }

    public static DecisionAuditEntry of(UUID actorId, ResourceType resourceType, ActionType actionType,
                                        String resourceId, PermissionDecision decision,
                                        ClientRequestContext request, OffsetDateTime decidedAt) {
        return new DecisionAuditEntry(actorId, resourceType, actionType, resourceId, decision.allowed(),
                decision.source(), decision.reason(), decision.infrastructureFailure(), request, decidedAt);
    }
}
