package com.nnipa.admin.security;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Salted one-way digest of a credential in BCrypt modular crypt format
 * ({@code $2a$12$<22 char salt><31 char digest>}).
 *
 * <p>Instances are immutable. Wrapping never validates: a value read back from storage
 * may be corrupt, and that must only ever make verification fail, not construction.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class CredentialHash {

    public static final String ALGORITHM = "bcrypt";

    private static final Pattern BCRYPT_FORMAT =
            Pattern.compile("^\\$2([aby])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}$");

    private final String value;

    public static CredentialHash of(String encoded) {
        return new CredentialHash(encoded);
    }

    /**
     * @return true if the value has the shape of a BCrypt hash
     */
    public boolean isWellFormed() {
        return value != null && BCRYPT_FORMAT.matcher(value).matches();
    }

    /**
     * @return the BCrypt cost parameter, or -1 when the value is not well formed
     */
    public int getWorkFactor() {
        if (value == null) {
            return -1;
        }
        Matcher matcher = BCRYPT_FORMAT.matcher(value);
        return matcher.matches() ? Integer.parseInt(matcher.group(2)) : -1;
    }

    public String getAlgorithm() {
        return ALGORITHM;
    }

    @Override
    public String toString() {
        // never print the digest
        return "CredentialHash{algorithm=" + ALGORITHM + ", workFactor=" + getWorkFactor() + "}";
    }
}
