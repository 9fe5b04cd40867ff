package com.krabby.auth.identity;

import com.krabby.auth.identity.exceptions.DuplicateEmailException;
import com.krabby.auth.identity.exceptions.InvalidCredentialsException;
import com.krabby.auth.identity.exceptions.UnauthenticatedException;
import com.krabby.auth.identity.payload.AuthCredentialsResponse;
import com.krabby.auth.identity.payload.LoginParams;
import com.krabby.auth.identity.payload.RegisterParams;
import com.krabby.auth.identity.payload.WhoAmIResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirements;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.krabby.auth.identity.SessionPolicy.ACCESS_TOKEN_COOKIE;
import static com.krabby.auth.identity.SessionPolicy.REFRESH_TOKEN_COOKIE;

/**
 * REST controller for identity and auth related '{@code /v1/auth}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/auth")
@Slf4j
@Tag(name = "auth")
class AccountController {

    static final String REFRESH_TOKEN_HEADER = "X-Refresh-Token";

    private final AccountService accountService;
    private final TokenLifecycleManager tokenLifecycleManager;
    private final SessionPolicy sessionPolicy;

    @Autowired
    AccountController(
        @NonNull AccountService accountService,
        @NonNull TokenLifecycleManager tokenLifecycleManager,
        @NonNull SessionPolicy sessionPolicy
    ) {
        this.accountService = accountService;
        this.tokenLifecycleManager = tokenLifecycleManager;
        this.sessionPolicy = sessionPolicy;
    }

    /**
     * Creates a new account for the provided email. Registration doesn't sign the user in; clients
     * must follow up with a '{@code /login}' request.
     */
    @Operation(summary = "Create a new account")
    @SecurityRequirements
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "account created"),
        @ApiResponse(responseCode = "400", description = "request is not valid"),
        @ApiResponse(responseCode = "409", description = "an account with the given email already exists"),
        @ApiResponse(responseCode = "500", description = "internal server error"),
    })
    @NonNull
    @PostMapping("/register")
    ResponseEntity<Void> register(@Valid @NotNull @RequestBody RegisterParams params) {
        try {
            accountService.register(params);
            return ResponseEntity.status(HttpStatus.CREATED).build();
        } catch (DuplicateEmailException e) {
            log.trace("registration failed", e);
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    /**
     * <p>
     * Verifies the email and password of an account and issues fresh credentials (access and
     * refresh tokens). Any credentials issued earlier stop working.</p>
     * <p>
     * Credentials are returned both in the response body and as HTTP-only cookies.</p>
     */
    @Operation(summary = "Sign-in to an existing account")
    @SecurityRequirements
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "fresh credentials issued"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "email or password is not valid", content = @Content),
        @ApiResponse(responseCode = "408", description = "request timed out", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/login")
    ResponseEntity<AuthCredentialsResponse> login(@Valid @NotNull @RequestBody LoginParams params) {
        try {
            return credentials(accountService.login(params));
        } catch (InvalidCredentialsException e) {
            log.trace("login failed", e);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
    }

    /**
     * <p>
     * Issues fresh credentials (refresh and access tokens) in exchange for the current refresh
     * token. If the refresh token is invalid, expired, revoked or was already exchanged, it returns
     * HTTP 401.</p>
     * <p>
     * The refresh token is read from the {@code rtc} cookie, or the {@code X-Refresh-Token} header
     * when the cookie is absent.</p>
     */
    @Operation(summary = "Issue new credentials using a refresh token")
    @SecurityRequirements
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "fresh credentials issued"),
        @ApiResponse(responseCode = "401", description = "refresh token is missing, invalid, expired or re-used", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/refresh")
    ResponseEntity<AuthCredentialsResponse> refresh(
        @RequestHeader(value = REFRESH_TOKEN_HEADER, required = false) String refreshTokenHeader,
        @CookieValue(value = REFRESH_TOKEN_COOKIE, required = false) String refreshTokenCookie
    ) {
        val refreshToken = firstNonBlank(refreshTokenCookie, refreshTokenHeader);
        if (refreshToken == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        try {
            return credentials(tokenLifecycleManager.refresh(refreshToken));
        } catch (UnauthenticatedException e) {
            log.trace("credential refresh failed", e);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
    }

    /**
     * Revokes the session that the access token belongs to, invalidating both of its tokens, and
     * clears the credential cookies. Logging out of an already revoked session succeeds.
     */
    @Operation(summary = "Revoke credentials")
    @SecurityRequirements
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "sign-out successful"),
        @ApiResponse(responseCode = "401", description = "access token is missing, invalid or expired"),
        @ApiResponse(responseCode = "500", description = "internal server error"),
    })
    @NonNull
    @PostMapping("/logout")
    ResponseEntity<Void> logout(
        @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorizationHeader,
        @CookieValue(value = ACCESS_TOKEN_COOKIE, required = false) String accessTokenCookie
    ) {
        val accessToken = firstNonBlank(bearerToken(authorizationHeader), accessTokenCookie);
        if (accessToken == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        try {
            tokenLifecycleManager.logout(accessToken);
        } catch (UnauthenticatedException e) {
            log.trace("logout failed", e);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.noContent()
            .headers(headers -> addCookies(headers, sessionPolicy.expiredCookies()))
            .build();
    }

    /**
     * Returns the account that the presented access token authenticates.
     */
    @Operation(summary = "Get the authenticated account")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "access token is valid"),
        @ApiResponse(responseCode = "401", description = "access token is missing, invalid, expired or revoked", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/whoami")
    ResponseEntity<WhoAmIResponse> whoAmI(@NonNull @AuthenticationPrincipal Long principalId) {
        return ResponseEntity.ok(new WhoAmIResponse(principalId));
    }

    @NonNull
    private ResponseEntity<AuthCredentialsResponse> credentials(@NonNull TokenPair pair) {
        return ResponseEntity.ok()
            .headers(headers -> addCookies(headers, sessionPolicy.credentialCookies(pair)))
            .body(AuthCredentialsResponse.builder()
                .accessToken(pair.getAccessToken())
                .accessTokenExpiresAt(pair.getAccessTokenExpiresAt())
                .refreshToken(pair.getRefreshToken())
                .refreshTokenExpiresAt(pair.getRefreshTokenExpiresAt())
                .build());
    }

    private static void addCookies(@NonNull HttpHeaders headers, @NonNull List<ResponseCookie> cookies) {
        cookies.forEach(cookie -> headers.add(HttpHeaders.SET_COOKIE, cookie.toString()));
    }

    private static String bearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.toLowerCase().startsWith("bearer ")) {
            return null;
        }

        return authorizationHeader.substring(7);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }

        return second != null && !second.isBlank() ? second : null;
    }
}
