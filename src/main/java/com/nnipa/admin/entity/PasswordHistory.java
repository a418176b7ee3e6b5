package com.nnipa.admin.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Retired password hash kept to prevent password reuse.
 */
@Entity
@Table(name = "password_history", indexes = {
        @Index(name = "idx_password_history_user", columnList = "user_id, sequence_no")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PasswordHistory extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private AdminUser user;

    @Column(name = "sequence_no", nullable = false)
    private Long sequenceNo;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "retired_at", nullable = false)
    private LocalDateTime retiredAt;
}
