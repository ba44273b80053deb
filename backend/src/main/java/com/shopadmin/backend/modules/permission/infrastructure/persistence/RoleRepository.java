package com.shopadmin.backend.modules.permission.infrastructure.persistence;

import java.util.Optional;

import com.shopadmin.backend.modules.permission.domain.Role;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, String> {

    @Query("""
            select r
              from Role r
             where (:active is null or r.active = :active)
            """)
    Page<Role> search(@Param("active") Boolean active, Pageable pageable);

    /**
     * Serializes grant changes for one role.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Role r where r.code = :code")
    Optional<Role> findForUpdate(@Param("code") String code);

    long countByActiveTrue();
}
