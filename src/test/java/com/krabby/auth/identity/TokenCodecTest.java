package com.krabby.auth.identity;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.krabby.auth.identity.exceptions.InvalidTokenException;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenCodecTest {

    private static final String TEST_SIGNING_SECRET = "test-signing-secret";

    private TokenCodec codec;

    @BeforeEach
    void setUp() {
        codec = new TokenCodec(TEST_SIGNING_SECRET);
    }

    @Test
    void encode_thenDecode() throws InvalidTokenException {
        val expiresAt = Instant.now().plus(Duration.ofMinutes(15));
        val issued = codec.encode(42, expiresAt, TokenKind.ACCESS);
        val decoded = codec.decode(issued.getValue(), TokenKind.ACCESS);

        assertEquals(42, decoded.getIdentity());
        assertEquals(TokenKind.ACCESS, decoded.getKind());
        assertEquals(issued.getIssuedAt(), decoded.getIssuedAt());
        assertEquals(issued.getExpiresAt(), decoded.getExpiresAt());
        assertTrue(decoded.getExpiresAt().isAfter(decoded.getIssuedAt()));
    }

    @Test
    void encode_isUniqueWithinTheSameSecond() {
        val expiresAt = Instant.now().plus(Duration.ofMinutes(15));
        val first = codec.encode(7, expiresAt, TokenKind.REFRESH);
        val second = codec.encode(7, expiresAt, TokenKind.REFRESH);

        assertNotEquals(first.getValue(), second.getValue());
    }

    @Test
    void decode_withExpiredToken() {
        val token = codec.encode(1, Instant.now().minus(Duration.ofMinutes(1)), TokenKind.ACCESS);
        val e = assertThrows(InvalidTokenException.class, () -> codec.decode(token.getValue(), TokenKind.ACCESS));
        assertEquals(InvalidTokenException.Reason.EXPIRED, e.getReason());
    }

    @Test
    void decode_withForeignSignature() {
        val foreign = new TokenCodec("some-other-secret")
            .encode(1, Instant.now().plus(Duration.ofMinutes(15)), TokenKind.ACCESS);

        val e = assertThrows(InvalidTokenException.class, () -> codec.decode(foreign.getValue(), TokenKind.ACCESS));
        assertEquals(InvalidTokenException.Reason.FORGED, e.getReason());
    }

    @Test
    void decode_withWrongKind() {
        val refresh = codec.encode(1, Instant.now().plus(Duration.ofDays(1)), TokenKind.REFRESH);
        val e = assertThrows(InvalidTokenException.class, () -> codec.decode(refresh.getValue(), TokenKind.ACCESS));
        assertEquals(InvalidTokenException.Reason.WRONG_KIND, e.getReason());
        assertDoesNotThrow(() -> codec.decode(refresh.getValue(), TokenKind.REFRESH));
    }

    @Test
    void decode_withGarbage() {
        for (val token : new String[]{"", "not-a-token", "a.b.c"}) {
            val e = assertThrows(InvalidTokenException.class, () -> codec.decode(token, TokenKind.ACCESS));
            assertEquals(InvalidTokenException.Reason.MALFORMED, e.getReason());
        }
    }

    @Test
    void decode_withNonNumericSubject() {
        val token = JWT.create()
            .withSubject("not-a-number")
            .withIssuedAt(Instant.now())
            .withExpiresAt(Instant.now().plus(Duration.ofMinutes(5)))
            .withClaim(TokenCodec.KIND_CLAIM, TokenKind.ACCESS.getClaimValue())
            .sign(Algorithm.HMAC256(TEST_SIGNING_SECRET));

        val e = assertThrows(InvalidTokenException.class, () -> codec.decode(token, TokenKind.ACCESS));
        assertEquals(InvalidTokenException.Reason.MALFORMED, e.getReason());
    }

    @Test
    void decode_withoutExpiry() {
        val token = JWT.create()
            .withSubject("1")
            .withIssuedAt(Instant.now())
            .withClaim(TokenCodec.KIND_CLAIM, TokenKind.ACCESS.getClaimValue())
            .sign(Algorithm.HMAC256(TEST_SIGNING_SECRET));

        val e = assertThrows(InvalidTokenException.class, () -> codec.decode(token, TokenKind.ACCESS));
        assertEquals(InvalidTokenException.Reason.MALFORMED, e.getReason());
    }
}
