package com.krabby.auth.identity;

import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PasswordHasherTest {

    private PasswordHasher hasher;

    @BeforeEach
    void setUp() {
        // cheap parameters to keep the tests fast.
        hasher = new PasswordHasher(new Argon2PasswordEncoder(16, 32, 1, 1 << 12, 1));
    }

    @Test
    void hash_producesSaltedArgon2idStrings() {
        val first = hasher.hash("correct horse battery staple");
        val second = hasher.hash("correct horse battery staple");

        assertTrue(first.startsWith("$argon2id$"));
        assertNotEquals(first, second);
    }

    @Test
    void verify_withMatchingPassword() {
        val hash = hasher.hash("correct horse battery staple");
        assertTrue(hasher.verify("correct horse battery staple", hash));
    }

    @Test
    void verify_withWrongPassword() {
        val hash = hasher.hash("correct horse battery staple");
        assertFalse(hasher.verify("Correct horse battery staple", hash));
        assertFalse(hasher.verify("", hash));
    }

    @Test
    void verify_withHashFromDifferentParameters() {
        val other = new PasswordHasher(new Argon2PasswordEncoder(16, 32, 1, 1 << 13, 2));
        val hash = other.hash("p4ssw0rd-with-other-costs");

        assertTrue(hasher.verify("p4ssw0rd-with-other-costs", hash));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {
        "",
        "plaintext-password",
        "$argon2id$v=19$m=4096,t=1,p=1$",
        "$2a$10$N9qo8uLOickgx2ZMRZoMyeIjZAgcfl7p92ldGxad68LJZdL17lhWy",
    })
    void verify_withMissingOrMalformedHash(String storedHash) {
        assertFalse(hasher.verify("plaintext-password", storedHash));
    }
}
