package com.shopadmin.backend.modules.permission.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.UserPermissionOverride;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserPermissionOverrideRepository extends JpaRepository<UserPermissionOverride, UUID> {

    @Query("""
            select o
              from UserPermissionOverride o
             where o.userId = :userId
               and o.permission.id = :permissionId
            """)
    Optional<UserPermissionOverride> findOverride(@Param("userId") UUID userId,
                                                  @Param("permissionId") UUID permissionId);

    @Query("""
            select o
              from UserPermissionOverride o
              join fetch o.permission p
             where o.userId = :userId
             order by p.name
            """)
    List<UserPermissionOverride> findByUserId(@Param("userId") UUID userId);

    @Query("""
            select count(o)
              from UserPermissionOverride o
             where o.expiresAt is null
                or o.expiresAt > :now
            """)
    long countUnexpired(@Param("now") OffsetDateTime now);
}
