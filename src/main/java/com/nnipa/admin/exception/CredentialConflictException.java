package com.nnipa.admin.exception;

/**
 * Thrown when a principal's credential changed between the checks done outside the unit
 * of work and the write inside it.
 */
public class CredentialConflictException extends RuntimeException {

    public CredentialConflictException(String message) {
        super(message);
    }
}
