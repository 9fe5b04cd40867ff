package com.krabby.auth.identity.exceptions;

import lombok.NonNull;

/**
 * Thrown when the credential store can't be reached or doesn't answer. It is reported as HTTP 503.
 */
public class CredentialStoreException extends RuntimeException {

    public CredentialStoreException(@NonNull String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * A credential store operation that didn't finish within the request timeout. It is reported
     * as HTTP 408.
     */
    public static class TimedOut extends CredentialStoreException {

        public TimedOut(@NonNull String message, Throwable cause) {
            super(message, cause);
        }
    }
}
