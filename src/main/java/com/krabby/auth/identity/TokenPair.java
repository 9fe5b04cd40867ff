package com.krabby.auth.identity;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * A freshly issued access and refresh token for a single identity.
 */
@Value
@Builder
public class TokenPair {

    long identity;

    @NonNull
    @ToString.Exclude
    String accessToken;

    @NonNull
    Instant accessTokenExpiresAt;

    @NonNull
    @ToString.Exclude
    String refreshToken;

    @NonNull
    Instant refreshTokenExpiresAt;

    @NonNull
    Instant issuedAt;
}
