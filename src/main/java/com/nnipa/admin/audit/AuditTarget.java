package com.nnipa.admin.audit;

import lombok.Value;

/**
 * Entity type and id addressed by an admin path such as {@code /admin/users/42/password}.
 */
@Value
public class AuditTarget {

    private static final AuditTarget NONE = new AuditTarget(null, null);

    String entityType;
    String entityId;

    public static AuditTarget fromPath(String path) {
        if (path == null) {
            return NONE;
        }
        String[] parts = path.replaceAll("^/+|/+$", "").split("/");
        if (parts.length < 2 || parts[1].isEmpty()) {
            return NONE;
        }
        String entityId = parts.length >= 3 && !parts[2].isEmpty() ? parts[2] : null;
        return new AuditTarget(parts[1], entityId);
    }
}
