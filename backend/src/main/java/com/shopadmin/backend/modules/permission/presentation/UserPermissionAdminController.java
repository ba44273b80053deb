package com.shopadmin.backend.modules.permission.presentation;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.shopadmin.backend.global.security.SecurityUtils;
import com.shopadmin.backend.global.security.permission.RequiresPermission;
import com.shopadmin.backend.modules.permission.application.GrantMutationService;
import com.shopadmin.backend.modules.permission.application.GrantMutationService.SetUserOverrideCommand;
import com.shopadmin.backend.modules.permission.application.PermissionQueryService;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.domain.UserPermissionOverride;
import com.shopadmin.backend.modules.permission.presentation.dto.AssignRoleRequest;
import com.shopadmin.backend.modules.permission.presentation.dto.EffectivePermissionResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.SetUserOverrideRequest;
import com.shopadmin.backend.modules.permission.presentation.dto.UserOverrideResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.UserPermissionStatsResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users/{userId}")
public class UserPermissionAdminController {

    private final GrantMutationService grantMutationService;
    private final PermissionQueryService permissionQueryService;
    private final Clock clock;

    public UserPermissionAdminController(
            GrantMutationService grantMutationService,
            PermissionQueryService permissionQueryService,
            Clock clock
    ) {
        this.grantMutationService = grantMutationService;
        this.permissionQueryService = permissionQueryService;
        this.clock = clock;
    }

    @Operation(summary = "Set or clear the user's role")
    @RequiresPermission(resource = ResourceType.USER, action = ActionType.MANAGE, resourceIdParam = "userId")
    @PutMapping("/role")
    public ResponseEntity<Void> assignRole(
            @PathVariable UUID userId,
            @Valid @RequestBody AssignRoleRequest request
    ) {
        String roleCode = request.roleCode() == null || request.roleCode().isBlank()
                ? null
                : request.roleCode().trim().toUpperCase();
        grantMutationService.assignUserRole(userId, roleCode, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Overrides held by the user, expired ones flagged")
    @RequiresPermission(resource = ResourceType.USER, action = ActionType.READ, resourceIdParam = "userId")
    @GetMapping("/permissions")
    public ResponseEntity<List<UserOverrideResponse>> userOverrides(@PathVariable UUID userId) {
        return ResponseEntity.ok(permissionQueryService.userOverrides(userId));
    }

    @Operation(summary = "Permissions the user is allowed right now on one resource type")
    @RequiresPermission(resource = ResourceType.USER, action = ActionType.READ, resourceIdParam = "userId")
    @GetMapping("/permissions/resources/{resource}")
    public ResponseEntity<List<EffectivePermissionResponse>> effectivePermissionsForResource(
            @PathVariable UUID userId,
            @PathVariable String resource
    ) {
        ResourceType resourceType = PermissionAdminController.parseResource(resource);
        return ResponseEntity.ok(permissionQueryService.effectivePermissions(userId, resourceType));
    }

    @Operation(summary = "Role, override and effective permission counts for the user")
    @RequiresPermission(resource = ResourceType.USER, action = ActionType.READ, resourceIdParam = "userId")
    @GetMapping("/permissions/stats")
    public ResponseEntity<UserPermissionStatsResponse> userPermissionStats(@PathVariable UUID userId) {
        return ResponseEntity.ok(permissionQueryService.userPermissionStats(userId));
    }

    @Operation(summary = "Grant or deny one permission to the user, overriding the role")
    @RequiresPermission(resource = ResourceType.USER, action = ActionType.MANAGE, resourceIdParam = "userId")
    @PutMapping("/permissions/{permissionId}")
    public ResponseEntity<UserOverrideResponse> setUserOverride(
            @PathVariable UUID userId,
            @PathVariable UUID permissionId,
            @Valid @RequestBody SetUserOverrideRequest request
    ) {
        UserPermissionOverride override = grantMutationService.setUserOverride(new SetUserOverrideCommand(
                userId,
                permissionId,
                request.granted(),
                SecurityUtils.getCurrentUserId(),
                request.reason(),
                request.expiresAt()
        ));
        return ResponseEntity.ok(UserOverrideResponse.from(override, OffsetDateTime.now(clock)));
    }

    @RequiresPermission(resource = ResourceType.USER, action = ActionType.MANAGE, resourceIdParam = "userId")
    @DeleteMapping("/permissions/{permissionId}")
    public ResponseEntity<Void> clearUserOverride(
            @PathVariable UUID userId,
            @PathVariable UUID permissionId
    ) {
        grantMutationService.clearUserOverride(userId, permissionId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Permissions the user is allowed right now")
    @RequiresPermission(resource = ResourceType.USER, action = ActionType.READ, resourceIdParam = "userId")
    @GetMapping("/effective-permissions")
    public ResponseEntity<List<EffectivePermissionResponse>> effectivePermissions(@PathVariable UUID userId) {
        return ResponseEntity.ok(permissionQueryService.effectivePermissions(userId));
    }
}
