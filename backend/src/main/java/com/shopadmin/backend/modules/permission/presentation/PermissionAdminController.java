package com.shopadmin.backend.modules.permission.presentation;

import java.util.List;
import java.util.UUID;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.global.security.SecurityUtils;
import com.shopadmin.backend.global.security.permission.RequiresAnyPermission;
import com.shopadmin.backend.global.security.permission.RequiresPermission;
import com.shopadmin.backend.global.web.ClientRequestContext;
import com.shopadmin.backend.global.web.PageResponse;
import com.shopadmin.backend.modules.permission.application.PermissionCatalog;
import com.shopadmin.backend.modules.permission.application.PermissionCatalog.CreatePermissionCommand;
import com.shopadmin.backend.modules.permission.application.PermissionCatalog.UpdatePermissionCommand;
import com.shopadmin.backend.modules.permission.application.PermissionDecisionService;
import com.shopadmin.backend.modules.permission.application.PermissionQueryService;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.PermissionDecision;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.presentation.dto.CreatePermissionRequest;
import com.shopadmin.backend.modules.permission.presentation.dto.PermissionCheckRequest;
import com.shopadmin.backend.modules.permission.presentation.dto.PermissionCheckResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.PermissionResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.PermissionStatsResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.UpdatePermissionRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.servlet.http.HttpServletRequest;
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
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/permissions")
public class PermissionAdminController {

    private static final int MAX_PAGE_SIZE = 200;

    private final PermissionCatalog permissionCatalog;
    private final PermissionQueryService permissionQueryService;
    private final PermissionDecisionService permissionDecisionService;

    public PermissionAdminController(
            PermissionCatalog permissionCatalog,
            PermissionQueryService permissionQueryService,
            PermissionDecisionService permissionDecisionService
    ) {
        this.permissionCatalog = permissionCatalog;
        this.permissionQueryService = permissionQueryService;
        this.permissionDecisionService = permissionDecisionService;
    }

    @Operation(summary = "List catalog permissions")
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.READ)
    @GetMapping
    public ResponseEntity<PageResponse<PermissionResponse>> listPermissions(
            @RequestParam(name = "resource", required = false) String resource,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                Sort.by("resourceType", "actionType"));
        ResourceType resourceType = resource == null ? null : parseResource(resource);
        ActionType actionType = action == null ? null : parseAction(action);
        return ResponseEntity.ok(PageResponse.from(permissionCatalog
                .listPermissions(resourceType, actionType, active, pageable)
                .map(PermissionResponse::from)));
    }

    @Operation(summary = "Permissions defined for one resource type")
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.READ)
    @GetMapping("/resources/{resource}")
    public ResponseEntity<List<PermissionResponse>> permissionsByResource(@PathVariable String resource) {
        List<PermissionResponse> body = permissionCatalog.permissionsByResource(parseResource(resource)).stream()
                .map(PermissionResponse::from)
                .toList();
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Look up a permission by its resource.action name")
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.READ)
    @GetMapping("/by-name/{name}")
    public ResponseEntity<PermissionResponse> getPermissionByName(@PathVariable String name) {
        return ResponseEntity.ok(PermissionResponse.from(permissionCatalog.getPermissionByName(name)));
    }

    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.READ, resourceIdParam = "permissionId")
    @GetMapping("/{permissionId}")
    public ResponseEntity<PermissionResponse> getPermission(@PathVariable UUID permissionId) {
        return ResponseEntity.ok(PermissionResponse.from(permissionCatalog.getPermission(permissionId)));
    }

    @Operation(summary = "Define a new permission")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Capability already defined")
    })
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.MANAGE)
    @PostMapping
    public ResponseEntity<PermissionResponse> createPermission(@Valid @RequestBody CreatePermissionRequest request) {
        Permission permission = permissionCatalog.create(new CreatePermissionCommand(
                request.resource(),
                request.action(),
                request.displayName(),
                request.description()
        ), SecurityUtils.getCurrentUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(PermissionResponse.from(permission));
    }

    @Operation(summary = "Update display metadata or activation of a permission")
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.MANAGE, resourceIdParam = "permissionId")
    @PatchMapping("/{permissionId}")
    public ResponseEntity<PermissionResponse> updatePermission(
            @PathVariable UUID permissionId,
            @Valid @RequestBody UpdatePermissionRequest request
    ) {
        Permission permission = permissionCatalog.update(permissionId, new UpdatePermissionCommand(
                request.displayName(),
                request.description(),
                request.active()
        ), SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(PermissionResponse.from(permission));
    }

    @Operation(summary = "Delete a non-system permission")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "409", description = "System permission")
    })
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.ADMIN, resourceIdParam = "permissionId")
    @DeleteMapping("/{permissionId}")
    public ResponseEntity<Void> deletePermission(@PathVariable UUID permissionId) {
        permissionCatalog.delete(permissionId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Catalog, role and override counts")
    @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.READ)
    @GetMapping("/stats")
    public ResponseEntity<PermissionStatsResponse> stats() {
        return ResponseEntity.ok(permissionQueryService.stats());
    }

    @Operation(summary = "Evaluate a permission for any user",
            description = "Runs the same decision as request enforcement and records it in the decision log.")
    @RequiresAnyPermission({
            @RequiresPermission(resource = ResourceType.USER, action = ActionType.MANAGE),
            @RequiresPermission(resource = ResourceType.SYSTEM, action = ActionType.ADMIN)
    })
    @PostMapping("/check")
    public ResponseEntity<PermissionCheckResponse> checkPermission(
            @Valid @RequestBody PermissionCheckRequest request,
            HttpServletRequest httpRequest
    ) {
        PermissionDecision decision = permissionDecisionService.checkPermission(
                request.userId(),
                request.resource(),
                request.action(),
                request.resourceId(),
                ClientRequestContext.from(httpRequest)
        );
        return ResponseEntity.ok(PermissionCheckResponse.from(decision));
    }

    static ResourceType parseResource(String value) {
        try {
            return ResourceType.fromCode(value);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "permission.unknown_resource", ex.getMessage());
        }
    }

    static ActionType parseAction(String value) {
        try {
            return ActionType.fromCode(value);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "permission.unknown_action", ex.getMessage());
        }
    }
}
