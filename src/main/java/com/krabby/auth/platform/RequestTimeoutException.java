package com.krabby.auth.platform;

import lombok.NonNull;

/**
 * Thrown when work done on behalf of a request exceeds the configured request timeout. It is
 * reported as HTTP 408 and never retried.
 */
public class RequestTimeoutException extends RuntimeException {

    public RequestTimeoutException(@NonNull String message, Throwable cause) {
        super(message, cause);
    }
}
