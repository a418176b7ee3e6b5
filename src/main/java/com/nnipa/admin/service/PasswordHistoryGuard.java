package com.nnipa.admin.service;

import com.nnipa.admin.security.CredentialHash;
import com.nnipa.admin.security.CredentialHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Blocks reuse of recently retired passwords.
 *
 * <p>History lists are ordered oldest first, as appended on rotation; only the last
 * {@value #HISTORY_WINDOW} entries are compared. Each comparison is a full BCrypt
 * verification, so call this before acquiring a unit of work.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PasswordHistoryGuard {

    public static final int HISTORY_WINDOW = 3;

    private final CredentialHasher credentialHasher;

    public boolean wasUsedRecently(String candidate, List<CredentialHash> history) {
        if (history == null || history.isEmpty()) {
            return false;
        }
        int from = Math.max(0, history.size() - HISTORY_WINDOW);
        // newest first, stop at the first match
        for (int i = history.size() - 1; i >= from; i--) {
            if (credentialHasher.verify(candidate, history.get(i))) {
                log.debug("Candidate matches retired credential {} of {}", history.size() - i, HISTORY_WINDOW);
                return true;
            }
        }
        return false;
    }

    /**
     * The current credential always counts as used; otherwise defer to
     * {@link #wasUsedRecently(String, List)}.
     */
    public boolean isReuse(String candidate, CredentialHash current, List<CredentialHash> history) {
        if (current != null && credentialHasher.verify(candidate, current)) {
            return true;
        }
        return wasUsedRecently(candidate, history);
    }
}
