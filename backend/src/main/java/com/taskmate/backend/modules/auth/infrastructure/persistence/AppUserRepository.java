package com.taskmate.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.taskmate.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Email lookups are exact and case-sensitive.
 */
public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmail(String email);

    boolean existsByEmail(String email);
}
