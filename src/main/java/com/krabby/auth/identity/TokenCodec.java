package com.krabby.auth.identity;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.InvalidClaimException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.krabby.auth.config.AppConfiguration;
import com.krabby.auth.identity.exceptions.InvalidTokenException;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Signs and verifies HMAC-SHA256 JSON web tokens. Every token carries its subject (the identity),
 * issue and expiry timestamps, a random id and its {@link TokenKind}.
 */
@Component
class TokenCodec {

    static final String KIND_CLAIM = "knd";

    private final Algorithm algorithm;
    private final Map<TokenKind, JWTVerifier> verifiers = new EnumMap<>(TokenKind.class);

    @Autowired
    TokenCodec(@NonNull AppConfiguration config) {
        this(config.getAuth().getSigningSecret());
    }

    TokenCodec(@NonNull String signingSecret) {
        this.algorithm = Algorithm.HMAC256(signingSecret);
        for (val kind : TokenKind.values()) {
            verifiers.put(kind, JWT.require(algorithm).withClaim(KIND_CLAIM, kind.getClaimValue()).build());
        }
    }

    /**
     * Signs a new token issued now.
     */
    @NonNull
    SignedToken encode(long identity, @NonNull Instant expiresAt, @NonNull TokenKind kind) {
        return encode(identity, Instant.now(), expiresAt, kind);
    }

    /**
     * Signs a new token. Timestamps are truncated to seconds since that's what the token encodes.
     */
    @NonNull
    SignedToken encode(long identity, @NonNull Instant issuedAt, @NonNull Instant expiresAt, @NonNull TokenKind kind) {
        val issued = issuedAt.truncatedTo(ChronoUnit.SECONDS);
        val expiry = expiresAt.truncatedTo(ChronoUnit.SECONDS);
        val value = JWT.create()
            .withSubject(String.valueOf(identity))
            .withJWTId(UUID.randomUUID().toString())
            .withIssuedAt(issued)
            .withExpiresAt(expiry)
            .withClaim(KIND_CLAIM, kind.getClaimValue())
            .sign(algorithm);

        return new SignedToken(value, identity, kind, issued, expiry);
    }

    /**
     * Verifies the signature, expiry and kind of a token and extracts its claims.
     *
     * @throws InvalidTokenException if any of the checks fail.
     */
    @NonNull
    SignedToken decode(@NonNull String token, @NonNull TokenKind kind) throws InvalidTokenException {
        final DecodedJWT jwt;
        try {
            jwt = verifiers.get(kind).verify(token);
        } catch (TokenExpiredException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.EXPIRED, e);
        } catch (SignatureVerificationException | AlgorithmMismatchException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.FORGED, e);
        } catch (InvalidClaimException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.WRONG_KIND, e);
        } catch (JWTVerificationException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, e);
        }

        val subject = jwt.getSubject();
        val issuedAt = jwt.getIssuedAtAsInstant();
        val expiresAt = jwt.getExpiresAtAsInstant();
        if (subject == null || issuedAt == null || expiresAt == null) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "token is missing registered claims");
        }

        try {
            return new SignedToken(token, Long.parseLong(subject), kind, issuedAt, expiresAt);
        } catch (NumberFormatException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, e);
        }
    }

    @Value
    static class SignedToken {

        @NonNull
        @ToString.Exclude
        String value;

        long identity;

        @NonNull
        TokenKind kind;

        @NonNull
        Instant issuedAt;

        @NonNull
        Instant expiresAt;
    }
}
