package com.nnipa.admin.enums;

import com.nnipa.admin.service.PasswordPolicyService;

import java.util.Arrays;
import java.util.Optional;

/**
 * Rules a password must satisfy, keyed by the Passay error code each one reports.
 */
public enum PasswordRule {

    MIN_LENGTH("TOO_SHORT",
            "Password must be at least " + PasswordPolicyService.MIN_LENGTH + " characters long"),
    UPPERCASE("INSUFFICIENT_UPPERCASE",
            "Password must contain at least one uppercase letter"),
    DIGIT("INSUFFICIENT_DIGIT",
            "Password must contain at least one digit"),
    SPECIAL_CHARACTER(PasswordPolicyService.SPECIAL_ERROR_CODE,
            "Password must contain at least one special character from "
                    + PasswordPolicyService.SPECIAL_CHARACTERS);

    private final String errorCode;
    private final String description;

    PasswordRule(String errorCode, String description) {
        this.errorCode = errorCode;
        this.description = description;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<PasswordRule> fromErrorCode(String errorCode) {
        return Arrays.stream(values())
                .filter(rule -> rule.errorCode.equals(errorCode))
                .findFirst();
    }
}
