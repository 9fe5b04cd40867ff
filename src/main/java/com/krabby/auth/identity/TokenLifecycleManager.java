package com.krabby.auth.identity;

import com.krabby.auth.config.AppConfiguration;
import com.krabby.auth.identity.entities.ChatUser;
import com.krabby.auth.identity.exceptions.InvalidTokenException;
import com.krabby.auth.identity.exceptions.UnauthenticatedException;
import com.krabby.auth.identity.exceptions.UnauthenticatedException.Reason;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * <p>
 * Issues, rotates, revokes and checks token pairs. The credential store holds the only pair that
 * is valid for an identity at any time, so a token is accepted only if it decodes, hasn't
 * expired, equals the stored value and the session isn't logged out.</p>
 * <p>
 * Rotation is a conditional update keyed on the previously stored refresh token. When two
 * requests race to rotate the same refresh token, exactly one of them gets a new pair and the
 * other is rejected as {@link Reason#SUPERSEDED}.</p>
 */
@Slf4j
@Service
public class TokenLifecycleManager {

    private final CredentialStore credentialStore;
    private final TokenCodec tokenCodec;
    private final Duration accessTokenExpiry;
    private final Duration refreshTokenExpiry;

    @Autowired
    TokenLifecycleManager(
        @NonNull CredentialStore credentialStore,
        @NonNull TokenCodec tokenCodec,
        @NonNull AppConfiguration config
    ) {
        this(credentialStore, tokenCodec, config.getAuth().getAccessTokenExpiry(), config.getAuth().getRefreshTokenExpiry());
    }

    TokenLifecycleManager(
        @NonNull CredentialStore credentialStore,
        @NonNull TokenCodec tokenCodec,
        @NonNull Duration accessTokenExpiry,
        @NonNull Duration refreshTokenExpiry
    ) {
        this.credentialStore = credentialStore;
        this.tokenCodec = tokenCodec;
        this.accessTokenExpiry = accessTokenExpiry;
        this.refreshTokenExpiry = refreshTokenExpiry;
    }

    /**
     * Mints a fresh pair for an identity whose credentials were already verified, replacing any
     * pair it held before and reopening its session.
     *
     * @throws UnauthenticatedException if the identity has no credential record.
     */
    @NonNull
    @Transactional(rollbackFor = Throwable.class)
    public TokenPair issue(long identity) throws UnauthenticatedException {
        val pair = mint(identity);
        if (!credentialStore.storeTokens(identity, pair.getAccessToken(), pair.getRefreshToken())) {
            throw reject(Reason.UNKNOWN_IDENTITY, identity, "can't issue tokens to a missing account");
        }

        log.debug("issued token pair for account {}", identity);
        return pair;
    }

    /**
     * Exchanges the current refresh token of a session for a new pair.
     *
     * @throws UnauthenticatedException if the refresh token is invalid, revoked, no longer the
     *                                  stored one or lost a concurrent rotation.
     */
    @NonNull
    @Transactional(rollbackFor = Throwable.class)
    public TokenPair refresh(@NonNull String presentedRefreshToken) throws UnauthenticatedException {
        val identity = decode(presentedRefreshToken, TokenKind.REFRESH);
        val user = findUser(identity);
        if (user.isLoggedOut()) {
            throw reject(Reason.REVOKED, identity, "refresh token belongs to a logged out session");
        }

        if (!isStored(presentedRefreshToken, user.getRefreshToken())) {
            log.warn("account {} presented a refresh token that was already rotated", identity);
            throw reject(Reason.SUPERSEDED, identity, "refresh token is no longer current");
        }

        val pair = mint(identity);
        if (!credentialStore.rotateTokens(identity, presentedRefreshToken, pair.getAccessToken(), pair.getRefreshToken())) {
            log.warn("account {} lost a concurrent refresh token rotation", identity);
            throw reject(Reason.SUPERSEDED, identity, "refresh token was rotated concurrently");
        }

        log.debug("rotated token pair for account {}", identity);
        return pair;
    }

    /**
     * Logs an identity out, invalidating both of its tokens. Revoking an already revoked session
     * succeeds.
     *
     * @throws UnauthenticatedException if the identity has no credential record.
     */
    @Transactional(rollbackFor = Throwable.class)
    public void revoke(long identity) throws UnauthenticatedException {
        if (!credentialStore.markLoggedOut(identity)) {
            throw reject(Reason.UNKNOWN_IDENTITY, identity, "can't revoke session of a missing account");
        }

        log.debug("revoked session of account {}", identity);
    }

    /**
     * Resolves the identity behind an access token and revokes its session. A token whose session
     * is already revoked succeeds without further changes. On an open session, the token must be
     * the current one.
     *
     * @return the identity that was logged out.
     * @throws UnauthenticatedException if the access token can't be resolved to an identity.
     */
    @Transactional(rollbackFor = Throwable.class)
    public long logout(@NonNull String accessToken) throws UnauthenticatedException {
        val identity = decode(accessToken, TokenKind.ACCESS);
        val user = findUser(identity);
        if (user.isLoggedOut()) {
            log.debug("account {} is already logged out", identity);
            return identity;
        }

        if (!isStored(accessToken, user.getAccessToken())) {
            throw reject(Reason.SUPERSEDED, identity, "access token is no longer current");
        }

        revoke(identity);
        return identity;
    }

    /**
     * Guards protected operations.
     *
     * @return the identity that the access token authenticates.
     * @throws UnauthenticatedException if the token is invalid, revoked or no longer current.
     */
    @Transactional(readOnly = true, rollbackFor = Throwable.class)
    public long authenticate(@NonNull String accessToken) throws UnauthenticatedException {
        val identity = decode(accessToken, TokenKind.ACCESS);
        val user = findUser(identity);
        if (user.isLoggedOut()) {
            throw reject(Reason.REVOKED, identity, "access token belongs to a logged out session");
        }

        if (!isStored(accessToken, user.getAccessToken())) {
            throw reject(Reason.SUPERSEDED, identity, "access token is no longer current");
        }

        return identity;
    }

    @NonNull
    private TokenPair mint(long identity) {
        // both tokens share one whole-second issue time so their expiries keep the configured order.
        val now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        val access = tokenCodec.encode(identity, now, now.plus(accessTokenExpiry), TokenKind.ACCESS);
        val refresh = tokenCodec.encode(identity, now, now.plus(refreshTokenExpiry), TokenKind.REFRESH);
        return TokenPair.builder()
            .identity(identity)
            .accessToken(access.getValue())
            .accessTokenExpiresAt(access.getExpiresAt())
            .refreshToken(refresh.getValue())
            .refreshTokenExpiresAt(refresh.getExpiresAt())
            .issuedAt(access.getIssuedAt())
            .build();
    }

    private long decode(@NonNull String token, @NonNull TokenKind kind) throws UnauthenticatedException {
        try {
            return tokenCodec.decode(token, kind).getIdentity();
        } catch (InvalidTokenException e) {
            log.debug("{} token failed to decode ({})", kind.getClaimValue(), e.getReason());
            throw new UnauthenticatedException(Reason.INVALID_TOKEN, null, "token is not valid", e);
        }
    }

    @NonNull
    private ChatUser findUser(long identity) throws UnauthenticatedException {
        return credentialStore.findById(identity)
            .orElseThrow(() -> reject(Reason.UNKNOWN_IDENTITY, identity, "token subject doesn't exist"));
    }

    @NonNull
    private static UnauthenticatedException reject(@NonNull Reason reason, long identity, @NonNull String message) {
        log.debug("rejecting token of account {}: {} ({})", identity, message, reason);
        return new UnauthenticatedException(reason, identity, message);
    }

    private static boolean isStored(@NonNull String presented, String stored) {
        return stored != null && MessageDigest.isEqual(
            presented.getBytes(StandardCharsets.UTF_8),
            stored.getBytes(StandardCharsets.UTF_8));
    }
}
