package com.shopadmin.backend.modules.permission.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.modules.audit.application.AuditLogService;
import com.shopadmin.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.PermissionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Vocabulary of checkable capabilities.
 * <p>
 * {@link #resolve} is the hot-path lookup used by every permission check; the remaining
 * operations are administrative and each writes an audit entry in the same transaction.
 */
@Service
@Transactional(readOnly = true)
public class PermissionCatalog {

    private static final Logger log = LoggerFactory.getLogger(PermissionCatalog.class);

    private final PermissionRepository permissionRepository;
    private final AuditLogService auditLogService;
    private final AuthorizationCache cache;

    public PermissionCatalog(PermissionRepository permissionRepository,
                             AuditLogService auditLogService,
                             AuthorizationCache cache) {
        this.permissionRepository = permissionRepository;
        this.auditLogService = auditLogService;
        this.cache = cache;
    }

    /**
     * Catalog entry for a capability, active or not. Empty when the pair was never defined.
     */
    public Optional<Capability> resolve(ResourceType resourceType, ActionType actionType) {
        return cache.capability(resourceType, actionType,
                () -> permissionRepository.findByResourceTypeAndActionType(resourceType, actionType)
                        .map(Capability::of));
    }

    public Permission getPermission(UUID permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> ProblemException.notFound("permission.not_found",
                        "Permission " + permissionId + " does not exist"));
    }

    /**
     * Lookup by the derived {@code resource.action} name; case and surrounding blanks are ignored.
     */
    public Permission getPermissionByName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return permissionRepository.findByName(normalized)
                .orElseThrow(() -> ProblemException.notFound("permission.not_found",
                        "Permission " + normalized + " does not exist"));
    }

    public Page<Permission> listPermissions(ResourceType resourceType, ActionType actionType, Boolean active,
                                            Pageable pageable) {
        return permissionRepository.search(resourceType, actionType, active, pageable);
    }

    public List<Permission> permissionsByResource(ResourceType resourceType) {
        return permissionRepository.findByResourceTypeOrderByActionTypeAsc(resourceType);
    }

    @Transactional
    public Permission create(CreatePermissionCommand command, UUID actorId) {
        if (permissionRepository.existsByResourceTypeAndActionType(command.resourceType(), command.actionType())) {
            throw ProblemException.conflict("permission.duplicate",
                    "Permission " + Permission.nameOf(command.resourceType(), command.actionType()) + " already exists");
        }

        Permission permission = permissionRepository.saveAndFlush(new Permission(
                command.resourceType(),
                command.actionType(),
                command.displayName().trim(),
                command.description()
        ));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("permissionId", permission.getId().toString());
        detail.put("displayName", permission.getDisplayName());
        audit(AdminAuditAction.CREATE, permission, actorId, detail);
        cache.evictCatalog();

        log.info("Permission created name={} actor={}", permission.getName(), actorId);
        return permission;
    }

    @Transactional
    public Permission update(UUID permissionId, UpdatePermissionCommand command, UUID actorId) {
        Permission permission = getPermission(permissionId);
        Map<String, Object> detail = new LinkedHashMap<>();

        String displayName = command.displayName() == null ? null : command.displayName().trim();
        boolean displayNameChange = displayName != null && !displayName.equals(permission.getDisplayName());
        boolean descriptionChange = command.description() != null
                && !command.description().equals(permission.getDescription());
        if ((displayNameChange || descriptionChange) && permission.isSystem()) {
            throw ProblemException.conflict("permission.system_protected",
                    "System permission " + permission.getName() + " only allows activation changes");
        }
        if (displayNameChange) {
            detail.put("displayName", Map.of("from", permission.getDisplayName(), "to", displayName));
            permission.setDisplayName(displayName);
        }
        if (descriptionChange) {
            detail.put("descriptionChanged", true);
            permission.setDescription(command.description());
        }
        if (command.active() != null && command.active() != permission.isActive()) {
            detail.put("active", Map.of("from", permission.isActive(), "to", command.active()));
            permission.setActive(command.active());
        }

        if (detail.isEmpty()) {
            return permission;
        }

        audit(AdminAuditAction.UPDATE, permission, actorId, detail);
        cache.evictCatalog();
        log.info("Permission updated name={} changes={} actor={}", permission.getName(), detail.keySet(), actorId);
        return permission;
    }

    /**
     * Soft removal. Works for system permissions too; a deactivated capability is denied to everyone.
     */
    @Transactional
    public Permission deactivate(UUID permissionId, UUID actorId) {
        return update(permissionId, new UpdatePermissionCommand(null, null, false), actorId);
    }

    @Transactional
    public void delete(UUID permissionId, UUID actorId) {
        Permission permission = getPermission(permissionId);
        if (permission.isSystem()) {
            throw ProblemException.conflict("permission.system_protected",
                    "System permission " + permission.getName() + " cannot be deleted");
        }

        audit(AdminAuditAction.DELETE, permission, actorId, Map.of("permissionId", permission.getId().toString()));
        permissionRepository.delete(permission);
        permissionRepository.flush();
        cache.evictAll();

        log.info("Permission deleted name={} actor={}", permission.getName(), actorId);
    }

    private void audit(AdminAuditAction action, Permission permission, UUID actorId, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(
                action,
                AdminAuditResource.PERMISSION,
                permission.getName(),
                actorId,
                null,
                detail
        ));
    }

    public record CreatePermissionCommand(
            ResourceType resourceType,
            ActionType actionType,
            String displayName,
            String description
    ) {
    }

    public record UpdatePermissionCommand(
            String displayName,
            String description,
            Boolean active
    ) {
    }
}
