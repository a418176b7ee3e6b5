package com.nnipa.admin.enums;

/**
 * Admin principal account status
 */
public enum UserStatus {
    ACTIVE
}
