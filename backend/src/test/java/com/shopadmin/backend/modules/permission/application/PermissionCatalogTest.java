package com.shopadmin.backend.modules.permission.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.modules.audit.application.AuditLogService;
import com.shopadmin.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.permission.application.PermissionCatalog.CreatePermissionCommand;
import com.shopadmin.backend.modules.permission.application.PermissionCatalog.UpdatePermissionCommand;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.shopadmin.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class PermissionCatalogTest {

    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private AuditLogService auditLogService;

    private AuthorizationCache cache;
    private PermissionCatalog catalog;

    @BeforeEach
    void setUp() {
        cache = new AuthorizationCache(true, Duration.ofMinutes(5), 100);
        catalog = new PermissionCatalog(permissionRepository, auditLogService, cache);
    }

    @Test
    @DisplayName("resolve reads storage once and then serves the cached capability")
    void resolveIsCached() {
        Permission reportRead = TestEntities.permission(ResourceType.REPORT, ActionType.READ);
        when(permissionRepository.findByResourceTypeAndActionType(ResourceType.REPORT, ActionType.READ))
                .thenReturn(Optional.of(reportRead));

        Optional<Capability> first = catalog.resolve(ResourceType.REPORT, ActionType.READ);
        Optional<Capability> second = catalog.resolve(ResourceType.REPORT, ActionType.READ);

        assertThat(first).contains(Capability.of(reportRead));
        assertThat(second).isEqualTo(first);
        verify(permissionRepository, times(1)).findByResourceTypeAndActionType(ResourceType.REPORT, ActionType.READ);
    }

    @Test
    @DisplayName("creating a permission derives its name and audits CREATE")
    void createDerivesNameAndAudits() {
        when(permissionRepository.existsByResourceTypeAndActionType(ResourceType.COUPON, ActionType.MANAGE))
                .thenReturn(false);
        when(permissionRepository.saveAndFlush(any(Permission.class))).thenAnswer(inv -> {
            Permission permission = inv.getArgument(0);
            TestEntities.setField(permission, "id", UUID.randomUUID());
            return permission;
        });

        Permission created = catalog.create(new CreatePermissionCommand(
                ResourceType.COUPON, ActionType.MANAGE, "  Manage coupons ", "Issue and expire coupons"), ADMIN_ID);

        assertThat(created.getName()).isEqualTo("coupon.manage");
        assertThat(created.getDisplayName()).isEqualTo("Manage coupons");
        assertThat(created.isActive()).isTrue();
        assertThat(created.isSystem()).isFalse();

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo(AdminAuditAction.CREATE);
        assertThat(captor.getValue().resourceType()).isEqualTo(AdminAuditResource.PERMISSION);
        assertThat(captor.getValue().resourceKey()).isEqualTo("coupon.manage");
    }

    @Test
    @DisplayName("defining the same capability twice is a conflict")
    void duplicateCapabilityIsRejected() {
        when(permissionRepository.existsByResourceTypeAndActionType(ResourceType.COUPON, ActionType.MANAGE))
                .thenReturn(true);

        assertThatThrownBy(() -> catalog.create(new CreatePermissionCommand(
                ResourceType.COUPON, ActionType.MANAGE, "Manage coupons", null), ADMIN_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("permission.duplicate");
                });
        verify(permissionRepository, never()).saveAndFlush(any());
        verifyNoInteractions(auditLogService);
    }

    @Test
    @DisplayName("system permissions keep their display metadata")
    void systemPermissionMetadataIsProtected() {
        Permission systemAdmin = TestEntities.systemPermission(ResourceType.SYSTEM, ActionType.ADMIN);
        when(permissionRepository.findById(systemAdmin.getId())).thenReturn(Optional.of(systemAdmin));

        assertThatThrownBy(() -> catalog.update(systemAdmin.getId(),
                new UpdatePermissionCommand("Root", null, null), ADMIN_ID))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("permission.system_protected"));
        verifyNoInteractions(auditLogService);
    }

    @Test
    @DisplayName("system permissions can be deactivated, which evicts the cached capability")
    void systemPermissionCanBeDeactivated() {
        Permission systemAdmin = TestEntities.systemPermission(ResourceType.SYSTEM, ActionType.ADMIN);
        when(permissionRepository.findById(systemAdmin.getId())).thenReturn(Optional.of(systemAdmin));
        when(permissionRepository.findByResourceTypeAndActionType(ResourceType.SYSTEM, ActionType.ADMIN))
                .thenReturn(Optional.of(systemAdmin));
        assertThat(catalog.resolve(ResourceType.SYSTEM, ActionType.ADMIN)).hasValueSatisfying(
                capability -> assertThat(capability.active()).isTrue());

        Permission updated = catalog.deactivate(systemAdmin.getId(), ADMIN_ID);

        assertThat(updated.isActive()).isFalse();
        assertThat(catalog.resolve(ResourceType.SYSTEM, ActionType.ADMIN)).hasValueSatisfying(
                capability -> assertThat(capability.active()).isFalse());
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo(AdminAuditAction.UPDATE);
        assertThat(captor.getValue().detail()).containsKey("active");
    }

    @Test
    @DisplayName("an update that changes nothing is not audited")
    void noOpUpdateIsNotAudited() {
        Permission couponRead = TestEntities.permission(ResourceType.COUPON, ActionType.READ);
        when(permissionRepository.findById(couponRead.getId())).thenReturn(Optional.of(couponRead));

        catalog.update(couponRead.getId(), new UpdatePermissionCommand(null, null, true), ADMIN_ID);

        verifyNoInteractions(auditLogService);
    }

    @Test
    @DisplayName("system permissions cannot be deleted")
    void systemPermissionCannotBeDeleted() {
        Permission orderRead = TestEntities.systemPermission(ResourceType.ORDER, ActionType.READ);
        when(permissionRepository.findById(orderRead.getId())).thenReturn(Optional.of(orderRead));

        assertThatThrownBy(() -> catalog.delete(orderRead.getId(), ADMIN_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("permission.system_protected");
                });
        verify(permissionRepository, never()).delete(any());
    }

    @Test
    @DisplayName("custom permissions are deleted with a DELETE audit entry")
    void customPermissionIsDeleted() {
        Permission custom = TestEntities.permission(ResourceType.BANNER, ActionType.ADMIN);
        when(permissionRepository.findById(custom.getId())).thenReturn(Optional.of(custom));

        catalog.delete(custom.getId(), ADMIN_ID);

        verify(permissionRepository).delete(custom);
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo(AdminAuditAction.DELETE);
        assertThat(captor.getValue().resourceKey()).isEqualTo("banner.admin");
    }

    @Test
    @DisplayName("unknown permission id is not found")
    void unknownPermissionIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(permissionRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> catalog.getPermission(missing))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("permission.not_found");
                });
    }

    @Test
    @DisplayName("lookup by name normalizes case and blanks")
    void getPermissionByNameNormalizes() {
        Permission couponWrite = TestEntities.permission(ResourceType.COUPON, ActionType.WRITE);
        when(permissionRepository.findByName("coupon.write")).thenReturn(Optional.of(couponWrite));

        assertThat(catalog.getPermissionByName("  Coupon.WRITE ")).isSameAs(couponWrite);
    }

    @Test
    @DisplayName("lookup of an unknown name is not found")
    void getPermissionByNameUnknown() {
        when(permissionRepository.findByName("coupon.export")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> catalog.getPermissionByName("coupon.export"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("permission.not_found");
                });
    }

    @Test
    @DisplayName("a display name that differs only by surrounding blanks is not a change")
    void whitespaceOnlyDisplayNameIsNotAudited() {
        Permission couponRead = TestEntities.permission(ResourceType.COUPON, ActionType.READ);
        when(permissionRepository.findById(couponRead.getId())).thenReturn(Optional.of(couponRead));

        catalog.update(couponRead.getId(), new UpdatePermissionCommand("  coupon read  ", null, null), ADMIN_ID);

        assertThat(couponRead.getDisplayName()).isEqualTo("coupon read");
        verifyNoInteractions(auditLogService);
    }
}
