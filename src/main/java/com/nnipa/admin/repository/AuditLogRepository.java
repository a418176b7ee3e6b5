package com.nnipa.admin.repository;

import com.nnipa.admin.entity.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to the audit table. Only insert and query methods are exposed;
 * rows are never updated or deleted.
 */
@org.springframework.stereotype.Repository
public interface AuditLogRepository extends Repository<AuditLog, UUID> {

    AuditLog saveAndFlush(AuditLog auditLog);

    Optional<AuditLog> findById(UUID id);

    List<AuditLog> findByTraceIdOrderByCreatedAtAsc(String traceId);

    long count();

    long countByTraceId(String traceId);

    @Query("SELECT a FROM AuditLog a WHERE " +
            "(:traceId IS NULL OR a.traceId = :traceId) " +
            "AND (:entityType IS NULL OR a.entityType = :entityType) " +
            "AND (:actor IS NULL OR a.actor = :actor) " +
            "ORDER BY a.createdAt DESC")
    Page<AuditLog> search(@Param("traceId") String traceId,
                          @Param("entityType") String entityType,
                          @Param("actor") String actor,
                          Pageable pageable);
}
