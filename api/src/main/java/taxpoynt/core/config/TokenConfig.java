package taxpoynt.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import taxpoynt.core.model.token.TokenKind;

/**
 * Configuration for token issuance and validation.
 *
 * <p>Configuration prefix: {@code taxpoynt.auth.jwt}
 */
@ConfigMapping(prefix = "taxpoynt.auth.jwt")
public interface TokenConfig {

    /**
     * Issuer placed in the {@code iss} claim and required on validation.
     */
    @WithDefault("taxpoynt-platform")
    String issuer();

    /**
     * Audience placed in the {@code aud} claim and required on validation.
     */
    @WithDefault("taxpoynt-api")
    String audience();

    /**
     * Signing algorithm: HS256, HS384, HS512, RS256, RS384 or RS512.
     */
    @WithDefault("RS256")
    String algorithm();

    /**
     * RSA modulus size in bits for generated key pairs.
     */
    @WithDefault("2048")
    int keySize();

    @WithDefault("PT1H")
    Duration accessTokenTtl();

    @WithDefault("P30D")
    Duration refreshTokenTtl();

    @WithDefault("PT1H")
    Duration idTokenTtl();

    @WithDefault("P365D")
    Duration apiKeyTtl();

    @WithDefault("PT8H")
    Duration sessionTokenTtl();

    /**
     * Leeway applied to expiry and not-before checks.
     */
    @WithDefault("PT30S")
    Duration clockSkew();

    /**
     * How long a verified token stays in the validation cache.
     */
    @WithDefault("PT5M")
    Duration cacheTtl();

    @WithDefault("10000")
    long cacheMaxSize();

    /**
     * How long expired and revoked token records are kept before being purged.
     */
    @WithDefault("PT24H")
    Duration retention();

    /**
     * Default lifetime for a token kind.
     */
    default Duration ttlFor(TokenKind kind) {
        return switch (kind) {
            case ACCESS -> accessTokenTtl();
            case REFRESH -> refreshTokenTtl();
            case ID -> idTokenTtl();
            case API_KEY -> apiKeyTtl();
            case SESSION -> sessionTokenTtl();
        };
    }
}
