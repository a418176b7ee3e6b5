package com.nnipa.admin.service;

import com.nnipa.admin.dto.response.AuditLogResponse;
import com.nnipa.admin.entity.AuditLog;
import com.nnipa.admin.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Read-only queries over the audit trail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogService {

    private static final int MAX_PAGE_SIZE = 200;

    private final AuditLogRepository auditLogRepository;

    public Page<AuditLogResponse> search(String traceId, String entityType, String actor, int page, int size) {
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        log.debug("Searching audit logs traceId={} entityType={} actor={} page={} size={}",
                traceId, entityType, actor, page, pageSize);

        return auditLogRepository.search(
                        blankToNull(traceId),
                        blankToNull(entityType),
                        blankToNull(actor),
                        PageRequest.of(Math.max(page, 0), pageSize))
                .map(this::toResponse);
    }

    public List<AuditLogResponse> findByTraceId(String traceId) {
        return auditLogRepository.findByTraceIdOrderByCreatedAtAsc(traceId).stream()
                .map(this::toResponse)
                .toList();
    }

    private AuditLogResponse toResponse(AuditLog auditLog) {
        return AuditLogResponse.builder()
                .id(auditLog.getId())
                .traceId(auditLog.getTraceId())
                .method(auditLog.getMethod())
                .path(auditLog.getPath())
                .entityType(auditLog.getEntityType())
                .entityId(auditLog.getEntityId())
                .outcome(auditLog.getOutcome())
                .actor(auditLog.getActor())
                .ipAddress(auditLog.getIpAddress())
                .createdAt(auditLog.getCreatedAt())
                .build();
    }

    private static String blankToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
