package com.nnipa.admin.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One completed mutating admin request. Append-only: rows are inserted once and
 * never updated or deleted by the application.
 */
@Entity
@Immutable
@Table(name = "admin_audit_log", indexes = {
        @Index(name = "idx_audit_trace_id", columnList = "trace_id"),
        @Index(name = "idx_audit_actor", columnList = "actor"),
        @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id"),
        @Index(name = "idx_audit_created_at", columnList = "created_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditLog {

    public static final int MAX_PATH_LENGTH = 256;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "trace_id", nullable = false, length = 26, updatable = false)
    private String traceId;

    @Column(name = "method", nullable = false, length = 16, updatable = false)
    private String method;

    @Column(name = "path", nullable = false, length = MAX_PATH_LENGTH, updatable = false)
    private String path;

    @Column(name = "entity_type", length = 64, updatable = false)
    private String entityType;

    @Column(name = "entity_id", length = 64, updatable = false)
    private String entityId;

    @Column(name = "outcome", nullable = false, updatable = false)
    private Integer outcome;

    @Column(name = "actor", length = 64, updatable = false)
    private String actor;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
