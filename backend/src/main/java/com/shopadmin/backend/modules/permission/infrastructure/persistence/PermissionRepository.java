package com.shopadmin.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findByResourceTypeAndActionType(ResourceType resourceType, ActionType actionType);

    Optional<Permission> findByName(String name);

    boolean existsByResourceTypeAndActionType(ResourceType resourceType, ActionType actionType);

    List<Permission> findByResourceTypeOrderByActionTypeAsc(ResourceType resourceType);

    @Query("""
            select p
              from Permission p
             where (:resourceType is null or p.resourceType = :resourceType)
               and (:actionType is null or p.actionType = :actionType)
               and (:active is null or p.active = :active)
            """)
    Page<Permission> search(
            @Param("resourceType") ResourceType resourceType,
            @Param("actionType") ActionType actionType,
            @Param("active") Boolean active,
            Pageable pageable
    );

    long countByActiveTrue();
}
