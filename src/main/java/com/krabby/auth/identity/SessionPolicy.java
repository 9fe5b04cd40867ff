package com.krabby.auth.identity;

import com.krabby.auth.config.AppConfiguration;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNullElse;

/**
 * Decides how credential cookies are delivered to browsers. Cookies are always HTTP-only and are
 * marked secure only in the {@code production} environment.
 */
@Slf4j
@Component
public class SessionPolicy {

    public static final String ACCESS_TOKEN_COOKIE = "atc";
    public static final String REFRESH_TOKEN_COOKIE = "rtc";

    static final String PRODUCTION_ENVIRONMENT = "production";

    @Getter
    private final CookieAttributes cookieAttributes;

    @Autowired
    SessionPolicy(@NonNull AppConfiguration config) {
        this(cookieAttributes(
            config.getApp().getEnvironment(),
            config.getAuth().getCookieSameSite(),
            config.getAuth().getCookieDomain()));
    }

    SessionPolicy(@NonNull CookieAttributes cookieAttributes) {
        this.cookieAttributes = cookieAttributes;
    }

    /**
     * @param environment name of the deployment environment, compared case-insensitively.
     * @param sameSite    configured {@code SameSite} policy, {@code Lax} if {@literal null}.
     * @param domain      cookie domain, host-only cookies if {@literal null}.
     */
    @NonNull
    static CookieAttributes cookieAttributes(@NonNull String environment, AppConfiguration.SameSite sameSite, String domain) {
        val secure = PRODUCTION_ENVIRONMENT.equals(environment.trim().toLowerCase(Locale.ROOT));
        var policy = requireNonNullElse(sameSite, AppConfiguration.SameSite.LAX);
        if (policy == AppConfiguration.SameSite.NONE && !secure) {
            log.warn("SameSite=None requires secure cookies, using Lax in '{}' environment", environment);
            policy = AppConfiguration.SameSite.LAX;
        }

        return CookieAttributes.builder()
            .secure(secure)
            .httpOnly(true)
            .sameSite(policy)
            .domain(domain)
            .path("/")
            .build();
    }

    /**
     * @return cookies delivering both tokens of the pair, each living as long as its token.
     */
    @NonNull
    List<ResponseCookie> credentialCookies(@NonNull TokenPair pair) {
        return List.of(
            cookie(ACCESS_TOKEN_COOKIE, pair.getAccessToken(), Duration.between(pair.getIssuedAt(), pair.getAccessTokenExpiresAt())),
            cookie(REFRESH_TOKEN_COOKIE, pair.getRefreshToken(), Duration.between(pair.getIssuedAt(), pair.getRefreshTokenExpiresAt())));
    }

    /**
     * @return cookies that make browsers drop both credential cookies.
     */
    @NonNull
    List<ResponseCookie> expiredCookies() {
        return List.of(
            cookie(ACCESS_TOKEN_COOKIE, "", Duration.ZERO),
            cookie(REFRESH_TOKEN_COOKIE, "", Duration.ZERO));
    }

    @NonNull
    private ResponseCookie cookie(@NonNull String name, @NonNull String value, @NonNull Duration maxAge) {
        val builder = ResponseCookie.from(name, value)
            .maxAge(maxAge)
            .secure(cookieAttributes.isSecure())
            .httpOnly(cookieAttributes.isHttpOnly())
            .sameSite(cookieAttributes.getSameSite().getAttributeValue())
            .path(cookieAttributes.getPath());

        if (cookieAttributes.getDomain() != null) {
            builder.domain(cookieAttributes.getDomain());
        }

        return builder.build();
    }

    @Value
    @Builder
    public static class CookieAttributes {

        boolean secure;

        boolean httpOnly;

        @NonNull
        AppConfiguration.SameSite sameSite;

        String domain;

        @NonNull
        String path;
    }
}
