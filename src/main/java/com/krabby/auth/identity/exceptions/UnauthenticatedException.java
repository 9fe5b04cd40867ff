package com.krabby.auth.identity.exceptions;

import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown when a presented token doesn't authenticate its bearer. Clients only ever see HTTP 401;
 * the {@link Reason} and the identity (when known) are for logs.
 */
@Getter
public class UnauthenticatedException extends Exception {

    private final Reason reason;
    private final Long identity;

    public UnauthenticatedException(@NonNull Reason reason, Long identity, @NonNull String message) {
        this(reason, identity, message, null);
    }

    public UnauthenticatedException(@NonNull Reason reason, Long identity, @NonNull String message, Throwable cause) {
        super(String.format("%s (reason: %s, identity: %s)", message, reason, identity), cause);
        this.reason = reason;
        this.identity = identity;
    }

    public enum Reason {
        /**
         * The token didn't decode: bad signature, expired, malformed or of the wrong kind.
         */
        INVALID_TOKEN,

        /**
         * The token's subject has no credential record.
         */
        UNKNOWN_IDENTITY,

        /**
         * The session was logged out.
         */
        REVOKED,

        /**
         * The token is authentic but is no longer the stored one, i.e. a newer pair replaced it.
         */
        SUPERSEDED,
    }
}
