package com.agora.forum.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PasswordHasherTest {

    private PasswordHasher passwordHasher;

    @BeforeEach
    void setUp() {
        passwordHasher = new PasswordHasher(new BCryptPasswordEncoder(4));
    }

    @Test
    void verify_acceptsOriginalPlaintext() {
        String digest = passwordHasher.hash("secret1");

        assertThat(digest).isNotEqualTo("secret1");
        assertThat(passwordHasher.verify("secret1", digest)).isTrue();
    }

    @Test
    void verify_rejectsAnyOtherPlaintext() {
        String digest = passwordHasher.hash("secret1");

        assertThat(passwordHasher.verify("secret2", digest)).isFalse();
        assertThat(passwordHasher.verify("Secret1", digest)).isFalse();
        assertThat(passwordHasher.verify("", digest)).isFalse();
    }

    @Test
    void hash_isSaltedPerCall() {
        assertThat(passwordHasher.hash("secret1")).isNotEqualTo(passwordHasher.hash("secret1"));
    }

    @Test
    void verify_malformedOrMissingDigest_isFalseNotAnError() {
        assertThat(passwordHasher.verify("secret1", "not-a-bcrypt-digest")).isFalse();
        assertThat(passwordHasher.verify("secret1", "")).isFalse();
        assertThat(passwordHasher.verify("secret1", null)).isFalse();
        assertThat(passwordHasher.verify(null, passwordHasher.hash("secret1"))).isFalse();
    }

    @Test
    void plaintextSharingFirst72Bytes_doesNotMatch() {
        String prefix = "\u00e9".repeat(35) + "ab";
        String digest = passwordHasher.hash(prefix);

        assertThat(passwordHasher.verify(prefix + "-and-a-different-ending", digest)).isFalse();
        assertThat(passwordHasher.verify(prefix, digest)).isTrue();
    }

    @Test
    void hash_rejectsPlaintextLongerThan72Bytes() {
        String multiByte = "\u00e9".repeat(36) + "first";

        assertThat(multiByte.length()).isLessThanOrEqualTo(72);
        assertThatThrownBy(() -> passwordHasher.hash(multiByte))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(PasswordHasher.fitsBcrypt("\u00e9".repeat(36))).isTrue();
        assertThat(PasswordHasher.fitsBcrypt("\u00e9".repeat(36) + "x")).isFalse();
    }
}
