package com.nnipa.admin.exception;

import com.nnipa.admin.enums.PasswordRule;

import java.util.List;

/**
 * Thrown when a new password fails the strength policy or reuses a recent password.
 * A validation outcome, not an error condition.
 */
public class PasswordRejectedException extends RuntimeException {

    public enum Reason {
        POLICY,
        HISTORY
    }

    private final Reason reason;
    private final List<PasswordRule> unmetRules;

    private PasswordRejectedException(String message, Reason reason, List<PasswordRule> unmetRules) {
        super(message);
        this.reason = reason;
        this.unmetRules = List.copyOf(unmetRules);
    }

    public static PasswordRejectedException policy(List<PasswordRule> unmetRules) {
        return new PasswordRejectedException("Password does not meet requirements", Reason.POLICY, unmetRules);
    }

    public static PasswordRejectedException recentlyUsed() {
        return new PasswordRejectedException(
                "Password has been used recently. Please choose a different password.",
                Reason.HISTORY, List.of());
    }

    public Reason getReason() {
        return reason;
    }

    public List<PasswordRule> getUnmetRules() {
        return unmetRules;
    }

    public String getErrorCode() {
        return reason == Reason.POLICY ? "PASSWORD_POLICY_VIOLATION" : "PASSWORD_RECENTLY_USED";
    }
}
