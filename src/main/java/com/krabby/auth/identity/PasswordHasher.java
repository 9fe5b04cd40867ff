package com.krabby.auth.identity;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Hashes and verifies passwords with Argon2id. Hashes are self-describing PHC strings carrying a
 * random salt and the cost parameters.
 */
@Slf4j
@Component
public class PasswordHasher {

    private static final Pattern PHC_ARGON2 = Pattern.compile(
        "^\\$argon2(id|i|d)\\$v=\\d+\\$m=\\d+,t=\\d+,p=\\d+\\$[A-Za-z0-9+/]+={0,2}\\$[A-Za-z0-9+/]+={0,2}$");

    private final Argon2PasswordEncoder encoder;
    private final String decoyHash;

    PasswordHasher() {
        this(Argon2PasswordEncoder.defaultsForSpringSecurity_v5_8());
    }

    PasswordHasher(@NonNull Argon2PasswordEncoder encoder) {
        this.encoder = encoder;
        this.decoyHash = encoder.encode(UUID.randomUUID().toString());
    }

    @NonNull
    public String hash(@NonNull String plaintext) {
        return encoder.encode(plaintext);
    }

    /**
     * Checks a password against a stored hash. Fails closed: a {@literal null} or malformed hash
     * yields {@literal false} after verifying against a decoy hash, so that it costs as much time
     * as a wrong password.
     */
    public boolean verify(@NonNull String plaintext, String hash) {
        if (hash == null || !PHC_ARGON2.matcher(hash).matches()) {
            log.debug("stored password hash is missing or malformed");
            encoder.matches(plaintext, decoyHash);
            return false;
        }

        return encoder.matches(plaintext, hash);
    }
}
