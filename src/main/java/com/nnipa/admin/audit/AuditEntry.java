package com.nnipa.admin.audit;

import lombok.Builder;
import lombok.Value;

/**
 * Facts about one completed mutating request, as handed to {@link AuditRecorder}.
 */
@Value
@Builder
public class AuditEntry {
    String traceId;
    String method;
    String path;
    String entityType;
    String entityId;
    int outcome;
    String actor;
    String ipAddress;
}
