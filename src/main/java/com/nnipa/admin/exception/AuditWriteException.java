package com.nnipa.admin.exception;

/**
 * Thrown when an audit record cannot be written. Fatal to the enclosing unit of work:
 * the mutation it describes must not commit either.
 */
public class AuditWriteException extends RuntimeException {

    private final String traceId;

    public AuditWriteException(String message, String traceId, Throwable cause) {
        super(message, cause);
        this.traceId = traceId;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getErrorCode() {
        return "AUDIT_WRITE_FAILED";
    }
}
