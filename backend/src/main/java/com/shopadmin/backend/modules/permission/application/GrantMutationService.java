package com.shopadmin.backend.modules.permission.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.modules.audit.application.AuditLogService;
import com.shopadmin.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.auth.domain.AppUser;
import com.shopadmin.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.Role;
import com.shopadmin.backend.modules.permission.domain.RolePermission;
import com.shopadmin.backend.modules.permission.domain.UserPermissionOverride;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RolePermissionRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RoleRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.UserPermissionOverrideRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative changes to role grants, user overrides and role assignment.
 * <p>
 * Each change and its audit entry share one transaction. Changes to the same role or the same
 * user are serialized by a row lock on that role or user, so concurrent writers to one pair
 * apply in order and none is lost.
 */
@Service
@Transactional
public class GrantMutationService {

    private static final Logger log = LoggerFactory.getLogger(GrantMutationService.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final UserPermissionOverrideRepository overrideRepository;
    private final AppUserRepository appUserRepository;
    private final AuditLogService auditLogService;
    private final AuthorizationCache cache;
    private final Clock clock;

    public GrantMutationService(RoleRepository roleRepository,
                                PermissionRepository permissionRepository,
                                RolePermissionRepository rolePermissionRepository,
                                UserPermissionOverrideRepository overrideRepository,
                                AppUserRepository appUserRepository,
                                AuditLogService auditLogService,
                                AuthorizationCache cache,
                                Clock clock) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.overrideRepository = overrideRepository;
        this.appUserRepository = appUserRepository;
        this.auditLogService = auditLogService;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * Grants a permission to a role.
     *
     * @return {@code true} when a new grant was created, {@code false} when the role already had it
     */
    public boolean grantRolePermission(String roleCode, UUID permissionId, UUID grantedBy) {
        Role role = lockRole(roleCode);
        Permission permission = loadPermission(permissionId);
        return grant(role, permission, grantedBy);
    }

    public void revokeRolePermission(String roleCode, UUID permissionId, UUID revokedBy) {
        Role role = lockRole(roleCode);
        RolePermission grant = rolePermissionRepository.findGrant(role.getCode(), permissionId)
                .orElseThrow(() -> ProblemException.notFound("permission.grant_not_found",
                        "Role " + roleCode + " does not hold permission " + permissionId));
        revoke(grant, revokedBy);
    }

    /**
     * Makes the role hold exactly the given permissions, granting and revoking the difference.
     */
    public RolePermissionChanges replaceRolePermissions(String roleCode, Collection<UUID> permissionIds, UUID actorId) {
        Role role = lockRole(roleCode);
        Set<UUID> desired = new HashSet<>(permissionIds);

        List<RolePermission> current = rolePermissionRepository.findByRoleCode(role.getCode());
        Set<UUID> held = new HashSet<>();
        List<String> revoked = new ArrayList<>();
        for (RolePermission grant : current) {
            UUID heldId = grant.getPermission().getId();
            held.add(heldId);
            if (!desired.contains(heldId)) {
                revoked.add(grant.getPermission().getName());
                revoke(grant, actorId);
            }
        }

        List<String> granted = new ArrayList<>();
        for (UUID permissionId : desired) {
            if (held.contains(permissionId)) {
                continue;
            }
            Permission permission = loadPermission(permissionId);
            if (grant(role, permission, actorId)) {
                granted.add(permission.getName());
            }
        }

        log.info("Role permissions replaced role={} granted={} revoked={} actor={}",
                role.getCode(), granted.size(), revoked.size(), actorId);
        return new RolePermissionChanges(List.copyOf(granted), List.copyOf(revoked));
    }

    /**
     * Creates or replaces the user's override for one permission.
     */
    public UserPermissionOverride setUserOverride(SetUserOverrideCommand command) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.expiresAt() != null && !command.expiresAt().isAfter(now)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "permission.override_expired",
                    "expiresAt must be in the future");
        }

        lockUser(command.userId());
        Permission permission = loadPermission(command.permissionId());

        Optional<UserPermissionOverride> existing = overrideRepository.findOverride(command.userId(), permission.getId());
        UserPermissionOverride override = existing
                .orElseGet(() -> new UserPermissionOverride(command.userId(), permission));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("permission", permission.getName());
        detail.put("granted", command.granted());
        if (existing.isPresent()) {
            detail.put("previousGranted", override.isGranted());
        }
        if (command.reason() != null) {
            detail.put("reason", command.reason());
        }
        if (command.expiresAt() != null) {
            detail.put("expiresAt", command.expiresAt().toString());
        }

        override.apply(command.granted(), command.grantedBy(), command.reason(), command.expiresAt());
        UserPermissionOverride saved = overrideRepository.saveAndFlush(override);

        auditLogService.record(new AuditLogCommand(
                existing.isPresent() ? AdminAuditAction.UPDATE : AdminAuditAction.CREATE,
                AdminAuditResource.USER_PERMISSION,
                command.userId() + ":" + permission.getName(),
                command.grantedBy(),
                command.userId(),
                detail
        ));
        cache.evictUser(command.userId());

        log.info("User override set user={} permission={} granted={} expiresAt={} actor={}",
                command.userId(), permission.getName(), command.granted(), command.expiresAt(), command.grantedBy());
        return saved;
    }

    public void clearUserOverride(UUID userId, UUID permissionId, UUID clearedBy) {
        lockUser(userId);
        UserPermissionOverride override = overrideRepository.findOverride(userId, permissionId)
                .orElseThrow(() -> ProblemException.notFound("permission.override_not_found",
                        "User " + userId + " has no override for permission " + permissionId));

        String permissionName = override.getPermission().getName();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("permission", permissionName);
        detail.put("granted", override.isGranted());
        detail.put("cleared", true);

        overrideRepository.delete(override);
        overrideRepository.flush();

        auditLogService.record(new AuditLogCommand(
                AdminAuditAction.DELETE,
                AdminAuditResource.USER_PERMISSION,
                userId + ":" + permissionName,
                clearedBy,
                userId,
                detail
        ));
        cache.evictUser(userId);

        log.info("User override cleared user={} permission={} actor={}", userId, permissionName, clearedBy);
    }

    /**
     * Sets the actor's single role. A {@code null} role code removes it.
     */
    public void assignUserRole(UUID userId, String roleCode, UUID assignedBy) {
        AppUser user = lockUser(userId);
        String code = RoleAdminService.normalizeCode(roleCode);
        Role role = code == null || code.isEmpty() ? null : roleRepository.findById(code)
                .orElseThrow(() -> roleNotFound(code));

        String previous = user.getRole() != null ? user.getRole().getCode() : null;
        String next = role != null ? role.getCode() : null;
        if (Objects.equals(previous, next)) {
            return;
        }

        user.setRole(role);
        appUserRepository.saveAndFlush(user);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("from", previous);
        detail.put("to", next);
        auditLogService.record(new AuditLogCommand(
                AdminAuditAction.ASSIGN,
                AdminAuditResource.USER_ROLE,
                userId.toString(),
                assignedBy,
                userId,
                detail
        ));
        cache.evictUser(userId);

        log.info("User role assigned user={} from={} to={} actor={}", userId, previous, next, assignedBy);
    }

    private boolean grant(Role role, Permission permission, UUID grantedBy) {
        if (rolePermissionRepository.findGrant(role.getCode(), permission.getId()).isPresent()) {
            return false;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        rolePermissionRepository.saveAndFlush(new RolePermission(role, permission, grantedBy, now));

        auditLogService.record(new AuditLogCommand(
                AdminAuditAction.GRANT,
                AdminAuditResource.ROLE_PERMISSION,
                role.getCode() + ":" + permission.getName(),
                grantedBy,
                null,
                Map.of("role", role.getCode(), "permission", permission.getName())
        ));
        cache.evictRole(role.getCode());

        log.info("Role permission granted role={} permission={} actor={}", role.getCode(), permission.getName(), grantedBy);
        return true;
    }

    private void revoke(RolePermission grant, UUID revokedBy) {
        String roleCode = grant.getRole().getCode();
        String permissionName = grant.getPermission().getName();

        rolePermissionRepository.delete(grant);
        rolePermissionRepository.flush();

        auditLogService.record(new AuditLogCommand(
                AdminAuditAction.REVOKE,
                AdminAuditResource.ROLE_PERMISSION,
                roleCode + ":" + permissionName,
                revokedBy,
                null,
                Map.of("role", roleCode, "permission", permissionName)
        ));
        cache.evictRole(roleCode);

        log.info("Role permission revoked role={} permission={} actor={}", roleCode, permissionName, revokedBy);
    }

    private Role lockRole(String roleCode) {
        String code = RoleAdminService.normalizeCode(roleCode);
        return roleRepository.findForUpdate(code).orElseThrow(() -> roleNotFound(code));
    }

    private AppUser lockUser(UUID userId) {
        return appUserRepository.findForUpdate(userId)
                .orElseThrow(() -> ProblemException.notFound("user.not_found", "User " + userId + " does not exist"));
    }

    private Permission loadPermission(UUID permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> ProblemException.notFound("permission.not_found",
                        "Permission " + permissionId + " does not exist"));
    }

    private static ProblemException roleNotFound(String roleCode) {
        return ProblemException.notFound("role.not_found", "Role " + roleCode + " does not exist");
    }

    public record SetUserOverrideCommand(
            UUID userId,
            UUID permissionId,
            boolean granted,
            UUID grantedBy,
            String reason,
            OffsetDateTime expiresAt
    ) {
    }

    public record RolePermissionChanges(List<String> granted, List<String> revoked) {
    }
}
