package com.krabby.auth.identity;

import lombok.Getter;
import lombok.NonNull;

/**
 * Purpose of a token, carried in its {@code knd} claim so that a refresh token can never pass as
 * an access token and vice versa.
 */
@Getter
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(@NonNull String claimValue) {
        this.claimValue = claimValue;
    }
}
