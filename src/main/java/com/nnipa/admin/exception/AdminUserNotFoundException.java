package com.nnipa.admin.exception;

import java.util.UUID;

public class AdminUserNotFoundException extends RuntimeException {

    public AdminUserNotFoundException(UUID userId) {
        super("Admin user not found: " + userId);
    }
}
