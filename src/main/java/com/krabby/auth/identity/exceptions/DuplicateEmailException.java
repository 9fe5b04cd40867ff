package com.krabby.auth.identity.exceptions;

import lombok.NonNull;

public class DuplicateEmailException extends Exception {

    public DuplicateEmailException(@NonNull String message, Throwable cause) {
        super(message, cause);
    }
}
