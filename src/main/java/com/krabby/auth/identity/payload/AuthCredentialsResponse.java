package com.krabby.auth.identity.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.ToString;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthCredentialsResponse {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "token to exchange for fresh credentials once the access token expires")
    @NonNull
    @ToString.Exclude
    private String refreshToken;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "token to authorize the bearer on protected routes")
    @NonNull
    @ToString.Exclude
    private String accessToken;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, type = "integer", format = "int64", description = "epoch millis after which the access token expires")
    @NonNull
    private Instant accessTokenExpiresAt;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, type = "integer", format = "int64", description = "epoch millis after which the refresh token expires")
    @NonNull
    private Instant refreshTokenExpiresAt;
}
