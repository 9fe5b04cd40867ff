package com.krabby.auth.identity.exceptions;

import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown when a token fails to decode. The {@link Reason} is meant for logs only.
 */
@Getter
public class InvalidTokenException extends Exception {

    private final Reason reason;

    public InvalidTokenException(@NonNull Reason reason, @NonNull String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidTokenException(@NonNull Reason reason, @NonNull Throwable cause) {
        super(cause.getMessage(), cause);
        this.reason = reason;
    }

    public enum Reason {
        EXPIRED,
        FORGED,
        MALFORMED,
        WRONG_KIND,
    }
}
