package com.krabby.auth.identity;

import com.krabby.auth.config.AppConfiguration.SameSite;
import lombok.val;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class SessionPolicyTest {

    @ParameterizedTest
    @MethodSource("cookieAttributesTestCases")
    void cookieAttributes(String environment, SameSite configured, boolean expectedSecure, SameSite expectedSameSite) {
        val attributes = SessionPolicy.cookieAttributes(environment, configured, null);

        assertEquals(expectedSecure, attributes.isSecure());
        assertEquals(expectedSameSite, attributes.getSameSite());
        assertTrue(attributes.isHttpOnly());
        assertEquals("/", attributes.getPath());
        assertNull(attributes.getDomain());
    }

    static Stream<Arguments> cookieAttributesTestCases() {
        return Stream.of(
            // environment, configured same site, expected secure, expected same site
            arguments("production", null, true, SameSite.LAX),
            arguments("PRODUCTION", null, true, SameSite.LAX),
            arguments("Production", SameSite.STRICT, true, SameSite.STRICT),
            arguments("production", SameSite.NONE, true, SameSite.NONE),
            arguments("development", null, false, SameSite.LAX),
            arguments("staging", SameSite.STRICT, false, SameSite.STRICT),
            arguments("development", SameSite.NONE, false, SameSite.LAX),
            arguments("", null, false, SameSite.LAX));
    }

    @Test
    void credentialCookies() {
        val policy = new SessionPolicy(SessionPolicy.cookieAttributes("production", SameSite.STRICT, "krabby.test"));
        val issuedAt = Instant.parse("2024-01-01T00:00:00Z");
        val pair = TokenPair.builder()
            .identity(1)
            .accessToken("access-token")
            .accessTokenExpiresAt(issuedAt.plus(Duration.ofMinutes(15)))
            .refreshToken("refresh-token")
            .refreshTokenExpiresAt(issuedAt.plus(Duration.ofDays(7)))
            .issuedAt(issuedAt)
            .build();

        val cookies = policy.credentialCookies(pair);
        assertEquals(2, cookies.size());

        val access = cookies.get(0);
        assertEquals(SessionPolicy.ACCESS_TOKEN_COOKIE, access.getName());
        assertEquals("access-token", access.getValue());
        assertEquals(Duration.ofMinutes(15), access.getMaxAge());
        assertTrue(access.isSecure());
        assertTrue(access.isHttpOnly());
        assertEquals("Strict", access.getSameSite());
        assertEquals("krabby.test", access.getDomain());
        assertEquals("/", access.getPath());

        val refresh = cookies.get(1);
        assertEquals(SessionPolicy.REFRESH_TOKEN_COOKIE, refresh.getName());
        assertEquals("refresh-token", refresh.getValue());
        assertEquals(Duration.ofDays(7), refresh.getMaxAge());
    }

    @Test
    void expiredCookies() {
        val policy = new SessionPolicy(SessionPolicy.cookieAttributes("development", null, null));
        val cookies = policy.expiredCookies();

        assertEquals(2, cookies.size());
        cookies.forEach(cookie -> {
            assertEquals("", cookie.getValue());
            assertEquals(Duration.ZERO, cookie.getMaxAge());
            assertEquals("Lax", cookie.getSameSite());
            assertNull(cookie.getDomain());
        });
    }
}
