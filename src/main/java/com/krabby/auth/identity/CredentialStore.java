package com.krabby.auth.identity;

import com.krabby.auth.identity.entities.ChatUser;
import lombok.NonNull;

import java.util.Optional;

/**
 * Persistent storage of user credential records. Every token mutation is atomic: both tokens of
 * a pair and the session state change together or not at all.
 *
 * @see JpaCredentialStore
 */
public interface CredentialStore {

    @NonNull
    Optional<ChatUser> findById(long identity);

    @NonNull
    Optional<ChatUser> findByEmail(@NonNull String email);

    boolean existsByEmail(@NonNull String email);

    /**
     * Persists a new user record.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the email is taken.
     */
    @NonNull
    ChatUser create(@NonNull ChatUser user);

    /**
     * Overwrites both stored tokens, clears the logged-out flag and marks the user online.
     *
     * @return {@literal false} if no such user exists.
     */
    boolean storeTokens(long identity, @NonNull String accessToken, @NonNull String refreshToken);

    /**
     * Same as {@link #storeTokens(long, String, String)}, but only if the stored refresh token
     * equals {@code expectedRefreshToken} and the user isn't logged out.
     *
     * @return {@literal false} if the conditions didn't hold, e.g. a concurrent rotation won.
     */
    boolean rotateTokens(
        long identity,
        @NonNull String expectedRefreshToken,
        @NonNull String accessToken,
        @NonNull String refreshToken);

    /**
     * Sets the logged-out flag and marks the user offline. Repeated calls have no further effect.
     *
     * @return {@literal false} if no such user exists.
     */
    boolean markLoggedOut(long identity);
}
