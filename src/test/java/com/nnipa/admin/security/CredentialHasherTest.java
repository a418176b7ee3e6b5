package com.nnipa.admin.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialHasherTest {

    // low cost keeps the suite fast; production strength is asserted separately
    private final CredentialHasher hasher = new CredentialHasher(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("Hash then verify succeeds for the same candidate only")
    void verifiesOwnHash() {
        CredentialHash hash = hasher.hash("StrongPass1!");

        assertThat(hasher.verify("StrongPass1!", hash)).isTrue();
        assertThat(hasher.verify("StrongPass1?", hash)).isFalse();
    }

    @Test
    @DisplayName("Two hashes of the same candidate differ and both verify")
    void saltsEveryHash() {
        CredentialHash first = hasher.hash("StrongPass1!");
        CredentialHash second = hasher.hash("StrongPass1!");

        assertThat(first).isNotEqualTo(second);
        assertThat(hasher.verify("StrongPass1!", first)).isTrue();
        assertThat(hasher.verify("StrongPass1!", second)).isTrue();
    }

    @Test
    @DisplayName("Default hasher uses BCrypt with cost 12")
    void defaultWorkFactor() {
        CredentialHash hash = new CredentialHasher().hash("StrongPass1!");

        assertThat(hash.isWellFormed()).isTrue();
        assertThat(hash.getWorkFactor()).isEqualTo(CredentialHasher.WORK_FACTOR);
        assertThat(hash.getValue()).startsWith("$2a$12$").hasSize(60);
    }

    @Test
    @DisplayName("Malformed stored hashes verify as false instead of throwing")
    void malformedHashFailsClosed() {
        assertThat(hasher.verify("StrongPass1!", "not-a-hash")).isFalse();
        assertThat(hasher.verify("StrongPass1!", "$2a$12$tooShort")).isFalse();
        assertThat(hasher.verify("StrongPass1!", "")).isFalse();
        assertThat(hasher.verify("StrongPass1!", (String) null)).isFalse();
        assertThat(hasher.verify("StrongPass1!", (CredentialHash) null)).isFalse();
        assertThat(hasher.verify(null, hasher.hash("StrongPass1!"))).isFalse();
    }

    @Test
    @DisplayName("Hashing null is a programming error")
    void rejectsNullCandidate() {
        assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("String form never exposes the digest")
    void toStringHidesDigest() {
        CredentialHash hash = hasher.hash("StrongPass1!");

        assertThat(hash.toString()).doesNotContain(hash.getValue()).contains("bcrypt");
        assertThat(CredentialHash.of("garbage").getWorkFactor()).isEqualTo(-1);
    }
}
