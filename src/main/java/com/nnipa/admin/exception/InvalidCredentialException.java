package com.nnipa.admin.exception;

/**
 * Exception thrown when a presented credential does not match the stored one.
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message) {
        super(message);
    }

    public String getErrorCode() {
        return "INVALID_CREDENTIAL";
    }
}
