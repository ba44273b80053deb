package com.shopadmin.backend.modules.permission.presentation.dto;

import com.shopadmin.backend.modules.permission.domain.DecisionSource;
import com.shopadmin.backend.modules.permission.domain.PermissionDecision;

public record PermissionCheckResponse(
        boolean hasPermission,
        DecisionSource source,
        String reason,
        boolean infrastructureFailure
) {

    public static PermissionCheckResponse from(PermissionDecision decision) {
        return new PermissionCheckResponse(decision.allowed(), decision.source(), decision.reason(),
                decision.infrastructureFailure());
    }
}
