package com.shopadmin.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.modules.auth.domain.AppUser;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("select u from AppUser u left join fetch u.role where lower(u.loginId) = lower(:loginId)")
    Optional<AppUser> findByLoginIdIgnoreCase(@Param("loginId") String loginId);

    @Query("""
            select r.code
              from AppUser u
              join u.role r
             where u.id = :userId
            """)
    Optional<String> findRoleCodeById(@Param("userId") UUID userId);

    /**
     * Serializes override and role changes for one user.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from AppUser u where u.id = :userId")
    Optional<AppUser> findForUpdate(@Param("userId") UUID userId);
}
