package com.nnipa.admin.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way hashing and verification of credentials with BCrypt.
 *
 * <p>Both operations are slow (cost {@value #WORK_FACTOR}); callers must not
 * hold a unit of work open while invoking them.
 */
@Slf4j
@Component
public class CredentialHasher {

    public static final int WORK_FACTOR = 12;

    private final PasswordEncoder passwordEncoder;

    public CredentialHasher() {
        this(new BCryptPasswordEncoder(WORK_FACTOR));
    }

    CredentialHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Hash with a freshly generated salt. Two hashes of the same candidate differ but
     * both verify.
     */
    public CredentialHash hash(String candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("Credential must not be null");
        }
        return CredentialHash.of(passwordEncoder.encode(candidate));
    }

    public boolean verify(String candidate, CredentialHash stored) {
        return stored != null && verify(candidate, stored.getValue());
    }

    /**
     * Fail-closed verification: a null, blank or malformed stored hash, or any error
     * raised while checking it, yields {@code false}.
     */
    public boolean verify(String candidate, String storedHash) {
        if (candidate == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(candidate, storedHash);
        } catch (RuntimeException ex) {
            log.warn("Stored credential hash could not be parsed, treating as mismatch: {}",
                    ex.getClass().getSimpleName());
            return false;
        }
    }
}
