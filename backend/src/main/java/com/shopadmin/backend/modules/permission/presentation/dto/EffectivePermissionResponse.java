package com.shopadmin.backend.modules.permission.presentation.dto;

import java.util.UUID;

import com.shopadmin.backend.modules.permission.application.Capability;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.DecisionSource;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

public record EffectivePermissionResponse(
        UUID permissionId,
        String name,
        ResourceType resource,
        ActionType action,
        DecisionSource source
) {

    public static EffectivePermissionResponse of(Capability capability, DecisionSource source) {
        return new EffectivePermissionResponse(
                capability.permissionId(),
                capability.name(),
                capability.resourceType(),
                capability.actionType(),
                source
        );
    }
}
