package com.nnipa.admin.repository;

import com.nnipa.admin.entity.AdminUser;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AdminUserRepository extends JpaRepository<AdminUser, UUID> {

    @EntityGraph(attributePaths = "passwordHistory")
    Optional<AdminUser> findWithPasswordHistoryById(UUID id);

    /**
     * Usernames are stored lower case; pass the value through {@link AdminUser#normalizeUsername(String)}.
     */
    Optional<AdminUser> findByUsername(String username);

    boolean existsByUsername(String username);
}
