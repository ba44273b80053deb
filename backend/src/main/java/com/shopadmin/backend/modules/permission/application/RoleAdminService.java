package com.shopadmin.backend.modules.permission.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.modules.audit.application.AuditLogService;
import com.shopadmin.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.permission.domain.Role;
import com.shopadmin.backend.modules.permission.domain.RolePermission;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RolePermissionRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class RoleAdminService {

    private static final Logger log = LoggerFactory.getLogger(RoleAdminService.class);

    private final RoleRepository roleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final AuditLogService auditLogService;
    private final AuthorizationCache cache;

    public RoleAdminService(RoleRepository roleRepository,
                            RolePermissionRepository rolePermissionRepository,
                            AuditLogService auditLogService,
                            AuthorizationCache cache) {
        this.roleRepository = roleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.auditLogService = auditLogService;
        this.cache = cache;
    }

    public Page<Role> listRoles(Boolean active, Pageable pageable) {
        return roleRepository.search(active, pageable);
    }

    public Role getRole(String roleCode) {
        return roleRepository.findById(normalizeCode(roleCode))
                .orElseThrow(() -> ProblemException.notFound("role.not_found", "Role " + roleCode + " does not exist"));
    }

    public List<RolePermission> grantsOf(String roleCode) {
        Role role = getRole(roleCode);
        return rolePermissionRepository.findByRoleCode(role.getCode());
    }

    @Transactional
    public Role createRole(CreateRoleCommand command, UUID actorId) {
        String code = normalizeCode(command.code());
        if (roleRepository.existsById(code)) {
            throw ProblemException.conflict("role.duplicate", "Role " + code + " already exists");
        }

        Role role = roleRepository.saveAndFlush(new Role(code, command.displayName().trim(), command.description()));
        audit(AdminAuditAction.CREATE, role, actorId, Map.of("displayName", role.getDisplayName()));

        log.info("Role created code={} actor={}", code, actorId);
        return role;
    }

    @Transactional
    public Role updateRole(String roleCode, UpdateRoleCommand command, UUID actorId) {
        Role role = getRole(roleCode);
        String displayName = command.displayName() == null ? null : command.displayName().trim();
        boolean displayNameChange = displayName != null && !displayName.equals(role.getDisplayName());
        boolean descriptionChange = command.description() != null
                && !command.description().equals(role.getDescription());
        if ((displayNameChange || descriptionChange) && role.isSystem()) {
            throw ProblemException.conflict("role.system_protected",
                    "System role " + role.getCode() + " only allows activation changes");
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        if (displayNameChange) {
            detail.put("displayName", Map.of("from", role.getDisplayName(), "to", displayName));
            role.setDisplayName(displayName);
        }
        if (descriptionChange) {
            detail.put("descriptionChanged", true);
            role.setDescription(command.description());
        }
        if (command.active() != null && command.active() != role.isActive()) {
            detail.put("active", Map.of("from", role.isActive(), "to", command.active()));
            role.setActive(command.active());
        }

        if (detail.isEmpty()) {
            return role;
        }

        audit(AdminAuditAction.UPDATE, role, actorId, detail);
        cache.evictRole(role.getCode());
        log.info("Role updated code={} changes={} actor={}", role.getCode(), detail.keySet(), actorId);
        return role;
    }

    /**
     * Removes a non-system role. Its grants are cascaded and holders are left without a role.
     */
    @Transactional
    public void deleteRole(String roleCode, UUID actorId) {
        Role role = getRole(roleCode);
        if (role.isSystem()) {
            throw ProblemException.conflict("role.system_protected", "System role " + role.getCode() + " cannot be deleted");
        }

        audit(AdminAuditAction.DELETE, role, actorId, Map.of("code", role.getCode()));
        roleRepository.delete(role);
        roleRepository.flush();
        cache.evictAll();

        log.info("Role deleted code={} actor={}", role.getCode(), actorId);
    }

    private void audit(AdminAuditAction action, Role role, UUID actorId, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(action, AdminAuditResource.ROLE, role.getCode(), actorId, null, detail));
    }

    static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    public record CreateRoleCommand(String code, String displayName, String description) {
    }

    public record UpdateRoleCommand(String displayName, String description, Boolean active) {
    }
}
