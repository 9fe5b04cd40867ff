package com.krabby.auth.identity.exceptions;

import lombok.NonNull;

/**
 * Thrown when a login attempt fails. Unknown accounts, inactive accounts and wrong passwords all
 * raise the same exception so that callers cannot tell them apart.
 */
public class InvalidCredentialsException extends Exception {

    public InvalidCredentialsException(@NonNull String message) {
        super(message);
    }

    public InvalidCredentialsException(@NonNull String message, Throwable cause) {
        super(message, cause);
    }
}
