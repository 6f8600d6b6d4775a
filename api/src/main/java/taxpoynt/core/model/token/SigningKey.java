package taxpoynt.core.model.token;

import java.security.Key;
import java.time.Instant;

/**
 * Signing material bound to a key id.
 *
 * <p>For symmetric algorithms the signing and verification keys are the same
 * secret. For asymmetric algorithms they are the private and public halves of
 * an RSA key pair.
 *
 * @param keyId key identifier carried in the token header
 * @param algorithm signing algorithm
 * @param signingKey key used to sign
 * @param verificationKey key used to verify
 * @param active whether this key signs new tokens
 * @param createdAt generation time
 */
public record SigningKey(
        String keyId, KeyAlgorithm algorithm, Key signingKey, Key verificationKey, boolean active, Instant createdAt) {

    public SigningKey {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        if (algorithm == null) {
            throw new IllegalArgumentException("Algorithm cannot be null");
        }
        if (signingKey == null || verificationKey == null) {
            throw new IllegalArgumentException("Key material cannot be null");
        }
    }

    /**
     * Demote this key to verification-only.
     */
    public SigningKey deactivate() {
        return new SigningKey(keyId, algorithm, signingKey, verificationKey, false, createdAt);
    }
}
