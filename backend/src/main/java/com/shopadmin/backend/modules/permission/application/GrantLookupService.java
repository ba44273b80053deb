package com.shopadmin.backend.modules.permission.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.shopadmin.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RolePermissionRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.UserPermissionOverrideRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the role and grant stores, as consulted by the decision engine.
 */
@Service
@Transactional(readOnly = true)
public class GrantLookupService {

    private final RolePermissionRepository rolePermissionRepository;
    private final UserPermissionOverrideRepository overrideRepository;
    private final AppUserRepository appUserRepository;
    private final AuthorizationCache cache;
    private final Clock clock;

    public GrantLookupService(RolePermissionRepository rolePermissionRepository,
                              UserPermissionOverrideRepository overrideRepository,
                              AppUserRepository appUserRepository,
                              AuthorizationCache cache,
                              Clock clock) {
        this.rolePermissionRepository = rolePermissionRepository;
        this.overrideRepository = overrideRepository;
        this.appUserRepository = appUserRepository;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * Active permissions of an active role; empty for unknown or inactive roles.
     */
    public Set<Capability> permissionsOf(String roleCode) {
        return cache.rolePermissions(roleCode, () -> rolePermissionRepository
                .findActivePermissionsOfActiveRole(roleCode)
                .stream()
                .map(Capability::of)
                .collect(Collectors.toUnmodifiableSet()));
    }

    public boolean roleGrants(String roleCode, UUID permissionId) {
        return permissionsOf(roleCode).stream()
                .anyMatch(capability -> capability.permissionId().equals(permissionId));
    }

    /**
     * The user's override for a permission, unless it has expired at the current instant.
     */
    public Optional<OverrideSnapshot> overrideOf(UUID userId, UUID permissionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return Optional.ofNullable(overridesOf(userId).get(permissionId))
                .filter(snapshot -> !snapshot.isExpired(now));
    }

    /**
     * Every override the user holds, keyed by permission id, expired ones included.
     */
    public Map<UUID, OverrideSnapshot> overridesOf(UUID userId) {
        return cache.userOverrides(userId, () -> overrideRepository.findByUserId(userId)
                .stream()
                .map(OverrideSnapshot::of)
                .collect(Collectors.toUnmodifiableMap(OverrideSnapshot::permissionId, Function.identity())));
    }

    public Optional<String> roleOf(UUID userId) {
        return cache.userRole(userId, () -> appUserRepository.findRoleCodeById(userId));
    }
}
