package com.shopadmin.backend.modules.permission.presentation;

import java.util.List;
import java.util.UUID;

import com.shopadmin.backend.global.security.SecurityUtils;
import com.shopadmin.backend.global.security.permission.RequiresPermission;
import com.shopadmin.backend.global.web.PageResponse;
import com.shopadmin.backend.modules.permission.application.GrantMutationService;
import com.shopadmin.backend.modules.permission.application.GrantMutationService.RolePermissionChanges;
import com.shopadmin.backend.modules.permission.application.PermissionCatalog;
import com.shopadmin.backend.modules.permission.application.RoleAdminService;
import com.shopadmin.backend.modules.permission.application.RoleAdminService.CreateRoleCommand;
import com.shopadmin.backend.modules.permission.application.RoleAdminService.UpdateRoleCommand;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.domain.Role;
import com.shopadmin.backend.modules.permission.presentation.dto.CreateRoleRequest;
import com.shopadmin.backend.modules.permission.presentation.dto.GrantResultResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.ReplaceRolePermissionsRequest;
import com.shopadmin.backend.modules.permission.presentation.dto.RoleDetailResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.RoleGrantResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.RolePermissionChangeResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.RoleResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.UpdateRoleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/roles")
public class RoleAdminController {

    private final RoleAdminService roleAdminService;
    private final GrantMutationService grantMutationService;
    private final PermissionCatalog permissionCatalog;

    public RoleAdminController(
            RoleAdminService roleAdminService,
            GrantMutationService grantMutationService,
            PermissionCatalog permissionCatalog
    ) {
        this.roleAdminService = roleAdminService;
        this.grantMutationService = grantMutationService;
        this.permissionCatalog = permissionCatalog;
    }

    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.READ)
    @GetMapping
    public ResponseEntity<PageResponse<RoleResponse>> listRoles(
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100), Sort.by("code"));
        return ResponseEntity.ok(PageResponse.from(roleAdminService.listRoles(active, pageable).map(RoleResponse::from)));
    }

    @Operation(summary = "Role with the permissions it grants")
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.READ, resourceIdParam = "roleCode")
    @GetMapping("/{roleCode}")
    public ResponseEntity<RoleDetailResponse> getRole(@PathVariable String roleCode) {
        Role role = roleAdminService.getRole(roleCode);
        List<RoleGrantResponse> grants = roleAdminService.grantsOf(role.getCode()).stream()
                .map(RoleGrantResponse::from)
                .toList();
        return ResponseEntity.ok(new RoleDetailResponse(RoleResponse.from(role), grants));
    }

    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.MANAGE)
    @PostMapping
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        Role role = roleAdminService.createRole(
                new CreateRoleCommand(request.code(), request.displayName(), request.description()),
                SecurityUtils.getCurrentUserId()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(RoleResponse.from(role));
    }

    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.MANAGE, resourceIdParam = "roleCode")
    @PatchMapping("/{roleCode}")
    public ResponseEntity<RoleResponse> updateRole(
            @PathVariable String roleCode,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        Role role = roleAdminService.updateRole(roleCode,
                new UpdateRoleCommand(request.displayName(), request.description(), request.active()),
                SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(RoleResponse.from(role));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "409", description = "System role")
    })
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.ADMIN, resourceIdParam = "roleCode")
    @DeleteMapping("/{roleCode}")
    public ResponseEntity<Void> deleteRole(@PathVariable String roleCode) {
        roleAdminService.deleteRole(roleCode, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Grant a permission to a role", description = "Idempotent: granting an existing pair changes nothing.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Grant created"),
            @ApiResponse(responseCode = "200", description = "Grant already present")
    })
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.MANAGE, resourceIdParam = "roleCode")
    @PutMapping("/{roleCode}/permissions/{permissionId}")
    public ResponseEntity<GrantResultResponse> grantRolePermission(
            @PathVariable String roleCode,
            @PathVariable UUID permissionId
    ) {
        Role role = roleAdminService.getRole(roleCode);
        boolean created = grantMutationService.grantRolePermission(role.getCode(), permissionId,
                SecurityUtils.getCurrentUserId());
        String permissionName = permissionCatalog.getPermission(permissionId).getName();
        GrantResultResponse body = new GrantResultResponse(role.getCode(), permissionName, created);
        return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.MANAGE, resourceIdParam = "roleCode")
    @DeleteMapping("/{roleCode}/permissions/{permissionId}")
    public ResponseEntity<Void> revokeRolePermission(
            @PathVariable String roleCode,
            @PathVariable UUID permissionId
    ) {
        Role role = roleAdminService.getRole(roleCode);
        grantMutationService.revokeRolePermission(role.getCode(), permissionId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Replace the full permission set of a role")
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.MANAGE, resourceIdParam = "roleCode")
    @PutMapping("/{roleCode}/permissions")
    public ResponseEntity<RolePermissionChangeResponse> replaceRolePermissions(
            @PathVariable String roleCode,
            @Valid @RequestBody ReplaceRolePermissionsRequest request
    ) {
        Role role = roleAdminService.getRole(roleCode);
        RolePermissionChanges changes = grantMutationService.replaceRolePermissions(role.getCode(),
                request.permissionIds(), SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(RolePermissionChangeResponse.from(changes));
    }
}
