package com.nnipa.admin.service;

import com.nnipa.admin.config.AdminProperties;
import com.nnipa.admin.dto.response.AdminUserResponse;
import com.nnipa.admin.entity.AdminUser;
import com.nnipa.admin.enums.UserStatus;
import com.nnipa.admin.exception.AdminUserNotFoundException;
import com.nnipa.admin.exception.CredentialConflictException;
import com.nnipa.admin.exception.DuplicateUsernameException;
import com.nnipa.admin.exception.InvalidCredentialException;
import com.nnipa.admin.exception.PasswordRejectedException;
import com.nnipa.admin.repository.AdminUserRepository;
import com.nnipa.admin.security.CredentialHash;
import com.nnipa.admin.security.CredentialHasher;
import com.nnipa.admin.web.AdminRequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Admin principal registration and credential rotation.
 *
 * <p>Every credential operation runs its policy, history and hashing work before asking
 * the request context for its unit of work, then re-reads the principal inside it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminUserService {

    private final AdminUserRepository adminUserRepository;
    private final PasswordPolicyService passwordPolicyService;
    private final PasswordHistoryGuard passwordHistoryGuard;
    private final CredentialHasher credentialHasher;
    private final AdminProperties adminProperties;

    /**
     * Register a new admin principal.
     */
    public AdminUserResponse createUser(AdminRequestContext context, String requestedUsername, String password) {
        String username = AdminUser.normalizeUsername(requestedUsername);
        log.info("Admin user registration requested: {}", username);

        requirePolicy(password);
        if (adminUserRepository.existsByUsername(username)) {
            throw new DuplicateUsernameException(username);
        }

        CredentialHash hash = credentialHasher.hash(password);
        LocalDateTime now = LocalDateTime.now();

        context.unitOfWork();
        AdminUser user = AdminUser.builder()
                .username(username)
                .passwordHash(hash.getValue())
                .passwordChangedAt(now)
                .passwordExpiresAt(now.plusDays(maxAgeDays()))
                .mustChangePassword(false)
                .status(UserStatus.ACTIVE)
                .build();
        AdminUser saved = adminUserRepository.saveAndFlush(user);

        log.info("Admin user created: {} ({})", saved.getUsername(), saved.getId());
        return toResponse(saved, now);
    }

    public AdminUserResponse getUser(UUID userId) {
        AdminUser user = adminUserRepository.findWithPasswordHistoryById(userId)
                .orElseThrow(() -> new AdminUserNotFoundException(userId));
        return toResponse(user, LocalDateTime.now());
    }

    /**
     * Change a principal's password after verifying the current one.
     */
    public void changePassword(AdminRequestContext context, UUID userId,
                               String currentPassword, String newPassword) {
        log.info("Password change requested for admin user: {}", userId);

        AdminUser user = adminUserRepository.findWithPasswordHistoryById(userId)
                .orElseThrow(() -> new AdminUserNotFoundException(userId));

        if (!credentialHasher.verify(currentPassword, user.getCredentialHash())) {
            throw new InvalidCredentialException("Current password is incorrect");
        }

        requirePolicy(newPassword);

        if (passwordHistoryGuard.isReuse(newPassword, user.getCredentialHash(), user.getCredentialHistory())) {
            log.info("Password change for admin user {} rejected: recently used", userId);
            throw PasswordRejectedException.recentlyUsed();
        }

        CredentialHash newHash = credentialHasher.hash(newPassword);

        context.unitOfWork();
        AdminUser managed = adminUserRepository.findWithPasswordHistoryById(userId)
                .orElseThrow(() -> new AdminUserNotFoundException(userId));
        if (!managed.getPasswordHash().equals(user.getPasswordHash())) {
            throw new CredentialConflictException("Password was changed concurrently, please retry");
        }

        managed.rotateCredential(newHash, PasswordHistoryGuard.HISTORY_WINDOW, LocalDateTime.now(), maxAgeDays());
        adminUserRepository.saveAndFlush(managed);

        log.info("Password changed successfully for admin user: {}", userId);
    }

    /**
     * Force a password rotation at next login.
     */
    public void expirePassword(AdminRequestContext context, UUID userId) {
        log.info("Forcing password expiry for admin user: {}", userId);

        context.unitOfWork();
        AdminUser user = adminUserRepository.findById(userId)
                .orElseThrow(() -> new AdminUserNotFoundException(userId));
        user.expireCredential(LocalDateTime.now());
        adminUserRepository.saveAndFlush(user);
    }

    private void requirePolicy(String password) {
        PasswordPolicyService.PasswordCheckResult result = passwordPolicyService.check(password);
        if (!result.isAccepted()) {
            log.info("Password rejected by policy: {}", result.getUnmetRules());
            throw PasswordRejectedException.policy(result.getUnmetRules());
        }
    }

    private int maxAgeDays() {
        return adminProperties.getPassword().getMaxAgeDays();
    }

    private AdminUserResponse toResponse(AdminUser user, LocalDateTime now) {
        return AdminUserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .status(user.getStatus())
                .passwordChangedAt(user.getPasswordChangedAt())
                .passwordExpiresAt(user.getPasswordExpiresAt())
                .mustChangePassword(Boolean.TRUE.equals(user.getMustChangePassword()))
                .passwordExpired(user.isPasswordExpired(now))
                .passwordHistorySize(user.getPasswordHistory().size())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
