package com.shopadmin.backend.modules.permission.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shopadmin.backend.modules.permission.domain.DecisionSource;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.domain.UserPermissionOverride;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RoleRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.UserPermissionOverrideRepository;
import com.shopadmin.backend.modules.permission.presentation.dto.EffectivePermissionResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.PermissionStatsResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.UserOverrideResponse;
import com.shopadmin.backend.modules.permission.presentation.dto.UserPermissionStatsResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative read models over grants. Not used on the decision path.
 */
@Service
@Transactional(readOnly = true)
public class PermissionQueryService {

    private final AppUserRepository appUserRepository;
    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;
    private final UserPermissionOverrideRepository overrideRepository;
    private final GrantLookupService grantLookupService;
    private final Clock clock;

    public PermissionQueryService(AppUserRepository appUserRepository,
                                  PermissionRepository permissionRepository,
                                  RoleRepository roleRepository,
                                  UserPermissionOverrideRepository overrideRepository,
                                  GrantLookupService grantLookupService,
                                  Clock clock) {
        this.appUserRepository = appUserRepository;
        this.permissionRepository = permissionRepository;
        this.roleRepository = roleRepository;
        this.overrideRepository = overrideRepository;
        this.grantLookupService = grantLookupService;
        this.clock = clock;
    }

    public List<UserOverrideResponse> userOverrides(UUID userId) {
        requireUser(userId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        return overrideRepository.findByUserId(userId).stream()
                .map(override -> UserOverrideResponse.from(override, now))
                .toList();
    }

    /**
     * Permissions the user would be allowed right now, with the grant that allows each one.
     * Mirrors the decision order: a live override decides, otherwise the role does.
     */
    public List<EffectivePermissionResponse> effectivePermissions(UUID userId) {
        requireUser(userId);
        OffsetDateTime now = OffsetDateTime.now(clock);

        Map<UUID, EffectivePermissionResponse> effective = new LinkedHashMap<>();
        Optional<String> roleCode = grantLookupService.roleOf(userId);
        roleCode.ifPresent(code -> grantLookupService.permissionsOf(code).forEach(capability ->
                effective.put(capability.permissionId(), EffectivePermissionResponse.of(capability, DecisionSource.ROLE))));

        for (UserPermissionOverride override : overrideRepository.findByUserId(userId)) {
            if (override.isExpired(now)) {
                continue;
            }
            UUID permissionId = override.getPermission().getId();
            if (!override.isGranted()) {
                effective.remove(permissionId);
            } else if (override.getPermission().isActive()) {
                effective.put(permissionId, EffectivePermissionResponse.of(
                        Capability.of(override.getPermission()), DecisionSource.USER_OVERRIDE));
            }
        }

        return effective.values().stream()
                .sorted(Comparator.comparing(EffectivePermissionResponse::name))
                .toList();
    }

    public List<EffectivePermissionResponse> effectivePermissions(UUID userId, ResourceType resourceType) {
        return effectivePermissions(userId).stream()
                .filter(permission -> permission.resource() == resourceType)
                .toList();
    }

    public UserPermissionStatsResponse userPermissionStats(UUID userId) {
        requireUser(userId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<String> roleCode = grantLookupService.roleOf(userId);
        long rolePermissions = roleCode.map(code -> (long) grantLookupService.permissionsOf(code).size()).orElse(0L);

        long grants = 0;
        long denies = 0;
        long expired = 0;
        for (UserPermissionOverride override : overrideRepository.findByUserId(userId)) {
            if (override.isExpired(now)) {
                expired++;
            } else if (override.isGranted()) {
                grants++;
            } else {
                denies++;
            }
        }
        return new UserPermissionStatsResponse(userId, roleCode.orElse(null), rolePermissions, grants, denies,
                expired, effectivePermissions(userId).size());
    }

    public PermissionStatsResponse stats() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return new PermissionStatsResponse(
                permissionRepository.count(),
                permissionRepository.countByActiveTrue(),
                roleRepository.count(),
                roleRepository.countByActiveTrue(),
                overrideRepository.count(),
                overrideRepository.countUnexpired(now)
        );
    }

    private void requireUser(UUID userId) {
        if (!appUserRepository.existsById(userId)) {
            throw ProblemException.notFound("user.not_found", "User " + userId + " does not exist");
        }
    }
}
