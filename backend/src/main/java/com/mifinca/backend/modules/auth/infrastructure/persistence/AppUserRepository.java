package com.mifinca.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.modules.auth.domain.AppUser;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("select u from AppUser u where lower(u.email) = lower(:email)")
    Optional<AppUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(u) > 0 then true else false end from AppUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select u
              from AppUser u
             where (:active is null or u.active = :active)
             order by lower(u.email)
            """)
    Page<AppUser> findByActiveFilter(@Param("active") Boolean active, Pageable pageable);
}
