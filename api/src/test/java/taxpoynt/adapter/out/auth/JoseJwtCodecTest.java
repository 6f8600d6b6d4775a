package taxpoynt.adapter.out.auth;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import taxpoynt.core.model.token.SigningKey;
import taxpoynt.core.model.token.TokenClaims;
import taxpoynt.core.model.token.TokenDecodingException;
import taxpoynt.core.model.token.TokenKind;
import taxpoynt.core.service.token.KeyManager;
import taxpoynt.support.AuthFixture;
import taxpoynt.support.MutableClock;
import taxpoynt.support.TestConfigs;

@DisplayName("JoseJwtCodec")
class JoseJwtCodecTest {

    private static final String ISSUER = "taxpoynt-platform";
    private static final String AUDIENCE = "taxpoynt-api";
    private static final Instant NOW = AuthFixture.START;

    private JoseJwtCodec codec;
    private SigningKey key;

    @BeforeEach
    void setUp() {
        codec = new JoseJwtCodec();
        key = new KeyManager(new TestConfigs.TestTokenConfig(), new MutableClock(NOW)).currentSigningKey();
    }

    private TokenClaims claims(Instant issuedAt, Duration ttl) {
        return new TokenClaims(
                "jti-1",
                "user-1",
                ISSUER,
                AUDIENCE,
                TokenKind.ACCESS,
                issuedAt,
                issuedAt,
                issuedAt.plus(ttl),
                Set.of("system_integrator"),
                Set.of("si:invoice:create", "si:invoice:view"),
                "tenant-1",
                "sess_1",
                null,
                Map.of("client", "erp"));
    }

    @Nested
    @DisplayName("encode and decode")
    class EncodeDecodeTests {

        @Test
        @DisplayName("should carry identity claims through signing")
        void shouldCarryIdentityClaims() {
            var token = codec.encode(claims(NOW, Duration.ofHours(1)), key);

            var decoded = codec.decode(token, key, ISSUER, AUDIENCE, Duration.ZERO, NOW.plusSeconds(60));

            assertEquals("jti-1", decoded.jti());
            assertEquals("user-1", decoded.subject());
            assertEquals(TokenKind.ACCESS, decoded.kind());
            assertEquals("tenant-1", decoded.tenantId());
            assertEquals("sess_1", decoded.sessionId());
            assertThat(decoded.roles(), containsInAnyOrder("system_integrator"));
            assertThat(decoded.permissions(), containsInAnyOrder("si:invoice:create", "si:invoice:view"));
            assertEquals("erp", decoded.custom().get("client"));
            assertEquals(NOW.plus(Duration.ofHours(1)), decoded.expiresAt());
        }

        @Test
        @DisplayName("should put the key id in the header")
        void shouldPutKeyIdInHeader() {
            var token = codec.encode(claims(NOW, Duration.ofHours(1)), key);

            assertEquals(key.keyId(), codec.peekKeyId(token).orElseThrow());
            assertEquals("jti-1", codec.peekJti(token).orElseThrow());
        }
    }

    @Nested
    @DisplayName("decode rejections")
    class DecodeRejectionTests {

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpiredToken() {
            var token = codec.encode(claims(NOW, Duration.ofMinutes(5)), key);

            var error = assertThrows(
                    TokenDecodingException.class,
                    () -> codec.decode(token, key, ISSUER, AUDIENCE, Duration.ZERO, NOW.plus(Duration.ofMinutes(10))));

            assertEquals("Token has expired", error.getMessage());
        }

        @Test
        @DisplayName("should reject a token for another audience")
        void shouldRejectWrongAudience() {
            var token = codec.encode(claims(NOW, Duration.ofHours(1)), key);

            var error = assertThrows(
                    TokenDecodingException.class,
                    () -> codec.decode(token, key, ISSUER, "other-api", Duration.ZERO, NOW));

            assertEquals("Invalid token audience", error.getMessage());
        }

        @Test
        @DisplayName("should reject a token signed with another key")
        void shouldRejectForeignSignature() {
            var other = new KeyManager(new TestConfigs.TestTokenConfig(), new MutableClock(NOW)).currentSigningKey();
            var token = codec.encode(claims(NOW, Duration.ofHours(1)), other);

            var error = assertThrows(
                    TokenDecodingException.class, () -> codec.decode(token, key, ISSUER, AUDIENCE, Duration.ZERO, NOW));

            assertEquals("Invalid token signature", error.getMessage());
        }

        @Test
        @DisplayName("should reject a token signed with an algorithm the key does not permit")
        void shouldRejectUnpermittedAlgorithm() {
            var config = new TestConfigs.TestTokenConfig();
            config.algorithm = "HS512";
            var hs512 = new KeyManager(config, new MutableClock(NOW)).currentSigningKey();
            var token = codec.encode(claims(NOW, Duration.ofHours(1)), hs512);

            var error = assertThrows(
                    TokenDecodingException.class, () -> codec.decode(token, key, ISSUER, AUDIENCE, Duration.ZERO, NOW));

            assertEquals("Invalid token signature", error.getMessage());
        }
    }

    @Test
    @DisplayName("should read nothing from a malformed token")
    void shouldReadNothingFromMalformedToken() {
        assertTrue(codec.peekKeyId("not-a-token").isEmpty());
        assertTrue(codec.peekJti("not-a-token").isEmpty());
    }
}
