package com.nnipa.admin.entity;

import com.nnipa.admin.enums.UserStatus;
import com.nnipa.admin.security.CredentialHash;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Admin principal with its current credential hash and bounded credential history.
 */
@Entity
@Table(name = "admin_users", indexes = {
        @Index(name = "idx_admin_user_username", columnList = "username", unique = true),
        @Index(name = "idx_admin_user_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminUser extends BaseEntity {

    @Column(name = "username", nullable = false, unique = true, length = 64)
    private String username;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "password_changed_at")
    private LocalDateTime passwordChangedAt;

    @Column(name = "password_expires_at")
    private LocalDateTime passwordExpiresAt;

    @Column(name = "must_change_password", nullable = false)
    @Builder.Default
    private Boolean mustChangePassword = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private UserStatus status = UserStatus.ACTIVE;

    // oldest first
    @OneToMany(mappedBy = "user", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sequenceNo ASC")
    @Builder.Default
    private List<PasswordHistory> passwordHistory = new ArrayList<>();

    /**
     * Canonical form under which usernames are stored and looked up, so the unique index
     * is case-insensitive in effect.
     */
    public static String normalizeUsername(String username) {
        return username == null ? null : username.trim().toLowerCase(Locale.ROOT);
    }

    @PrePersist
    @PreUpdate
    void onSave() {
        this.username = normalizeUsername(username);
    }

    public CredentialHash getCredentialHash() {
        return CredentialHash.of(passwordHash);
    }

    /**
     * @return retired credential hashes, oldest first
     */
    public List<CredentialHash> getCredentialHistory() {
        List<CredentialHash> hashes = new ArrayList<>(passwordHistory.size());
        for (PasswordHistory entry : passwordHistory) {
            hashes.add(CredentialHash.of(entry.getPasswordHash()));
        }
        return hashes;
    }

    /**
     * Replace the current credential. The outgoing hash is appended to the history and
     * entries beyond {@code historyWindow} are dropped from the front.
     */
    public void rotateCredential(CredentialHash newHash, int historyWindow,
                                 LocalDateTime now, int maxAgeDays) {
        long nextSequence = passwordHistory.isEmpty()
                ? 1L
                : passwordHistory.get(passwordHistory.size() - 1).getSequenceNo() + 1;

        passwordHistory.add(PasswordHistory.builder()
                .user(this)
                .sequenceNo(nextSequence)
                .passwordHash(passwordHash)
                .retiredAt(now)
                .build());

        while (passwordHistory.size() > historyWindow) {
            passwordHistory.remove(0);
        }

        this.passwordHash = newHash.getValue();
        this.passwordChangedAt = now;
        this.passwordExpiresAt = now.plusDays(maxAgeDays);
        this.mustChangePassword = false;
    }

    public void expireCredential(LocalDateTime now) {
        this.mustChangePassword = true;
        this.passwordExpiresAt = now;
    }

    public boolean isPasswordExpired(LocalDateTime now) {
        return Boolean.TRUE.equals(mustChangePassword)
                || (passwordExpiresAt != null && !passwordExpiresAt.isAfter(now));
    }
}
