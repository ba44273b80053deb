package com.shopadmin.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.RolePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, UUID> {

    @Query("""
            select rp
              from RolePermission rp
             where rp.role.code = :roleCode
               and rp.permission.id = :permissionId
            """)
    Optional<RolePermission> findGrant(@Param("roleCode") String roleCode, @Param("permissionId") UUID permissionId);

    @Query("""
            select rp
              from RolePermission rp
              join fetch rp.permission p
             where rp.role.code = :roleCode
             order by p.name
            """)
    List<RolePermission> findByRoleCode(@Param("roleCode") String roleCode);

    /**
     * Active permissions granted to an active role. Empty when the role is missing or inactive.
     */
    @Query("""
            select p
              from RolePermission rp
              join rp.role r
              join rp.permission p
             where r.code = :roleCode
               and r.active = true
               and p.active = true
            """)
    List<Permission> findActivePermissionsOfActiveRole(@Param("roleCode") String roleCode);
}
