package com.nnipa.admin.audit;

import com.nnipa.admin.entity.AuditLog;
import com.nnipa.admin.exception.AuditWriteException;
import com.nnipa.admin.persistence.UnitOfWork;
import com.nnipa.admin.repository.AuditLogRepository;
import com.nnipa.admin.trace.TraceId;
import com.nnipa.admin.web.AdminRequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Writes the single audit record of a mutating request.
 *
 * <p>The record is written inside the request's own unit of work, immediately before it
 * commits, so it becomes durable exactly when the mutation does. A failed write is
 * raised as {@link AuditWriteException}; callers must let it roll the unit of work back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditRecorder {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private static final int MAX_FIELD_LENGTH = 64;

    private final AuditLogRepository auditLogRepository;

    /**
     * Record a request outside the request filter, e.g. from a job. A null trace id is stored
     * as {@value TraceId#ABSENT}; the log context is never consulted.
     */
    public AuditLog record(UnitOfWork unitOfWork, TraceId traceId, String method, String path,
                           String entityType, int outcome, String actor) {
        AuditTarget target = AuditTarget.fromPath(path);
        return record(unitOfWork, AuditEntry.builder()
                .traceId(traceId != null ? traceId.toString() : TraceId.ABSENT)
                .method(method)
                .path(path)
                .entityType(entityType)
                .entityId(target.getEntityId())
                .outcome(outcome)
                .actor(actor)
                .build());
    }

    public AuditLog record(UnitOfWork unitOfWork, AdminRequestContext context, int outcome) {
        AuditTarget target = AuditTarget.fromPath(context.getPath());
        return record(unitOfWork, AuditEntry.builder()
                .traceId(context.getTraceId().toString())
                .method(context.getMethod())
                .path(context.getPath())
                .entityType(target.getEntityType())
                .entityId(target.getEntityId())
                .outcome(outcome)
                .actor(context.getActor())
                .ipAddress(context.getClientIp())
                .build());
    }

    public AuditLog record(UnitOfWork unitOfWork, AuditEntry entry) {
        if (unitOfWork == null || !unitOfWork.isActive()) {
            throw new IllegalStateException("Audit record requires an active unit of work, got "
                    + (unitOfWork == null ? "none" : unitOfWork.getState()));
        }

        String traceId = entry.getTraceId() != null ? entry.getTraceId() : TraceId.ABSENT;

        AuditLog auditLog = AuditLog.builder()
                .traceId(traceId)
                .method(entry.getMethod() == null ? null : entry.getMethod().toUpperCase(Locale.ROOT))
                .path(truncate(entry.getPath(), AuditLog.MAX_PATH_LENGTH))
                .entityType(truncate(entry.getEntityType(), MAX_FIELD_LENGTH))
                .entityId(truncate(entry.getEntityId(), MAX_FIELD_LENGTH))
                .outcome(entry.getOutcome())
                .actor(truncate(entry.getActor(), MAX_FIELD_LENGTH))
                .ipAddress(truncate(entry.getIpAddress(), 45))
                .createdAt(LocalDateTime.now())
                .build();

        AuditLog saved;
        try {
            saved = auditLogRepository.saveAndFlush(auditLog);
        } catch (RuntimeException ex) {
            log.error("Failed to write audit record for {} {} in {}: {}",
                    auditLog.getMethod(), auditLog.getPath(), unitOfWork.getName(), ex.getMessage());
            throw new AuditWriteException("Audit record could not be written", traceId, ex);
        }

        AUDIT.info("{} {} entity={}/{} outcome={} actor={} ip={}",
                saved.getMethod(), saved.getPath(), saved.getEntityType(), saved.getEntityId(),
                saved.getOutcome(), saved.getActor(), saved.getIpAddress());
        return saved;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
