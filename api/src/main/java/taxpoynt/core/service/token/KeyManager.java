package taxpoynt.core.service.token;

import java.math.BigInteger;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import taxpoynt.core.config.TokenConfig;
import taxpoynt.core.model.error.ConfigurationException;
import taxpoynt.core.model.token.KeyAlgorithm;
import taxpoynt.core.model.token.SigningKey;

/**
 * Holds token signing material and rotates it.
 *
 * <p>Exactly one key is current and signs new tokens. Rotation demotes the
 * previous key to verification-only; keys are never removed, so tokens signed
 * before a rotation stay verifiable until they expire.
 *
 * <h2>Thread Safety</h2>
 * Readers see an immutable {@link KeyState} snapshot through a single volatile
 * field. Rotations are serialized.
 */
@ApplicationScoped
public class KeyManager {

    private static final Logger LOG = Logger.getLogger(KeyManager.class);
    private static final int HMAC_SECRET_BYTES = 64;

    private final String configuredAlgorithm;
    private final int keySize;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final Object rotationLock = new Object();
    private final Map<String, AtomicLong> usage = new ConcurrentHashMap<>();

    /**
     * Immutable key snapshot; swapped atomically on rotation.
     */
    private record KeyState(SigningKey current, Map<String, SigningKey> keys) {
        static final KeyState EMPTY = new KeyState(null, Map.of());
    }

    private volatile KeyState state = KeyState.EMPTY;

    @Inject
    public KeyManager(TokenConfig config, Clock clock) {
        this.configuredAlgorithm = config.algorithm();
        this.keySize = config.keySize();
        this.clock = clock;
        try {
            rotate();
        } catch (ConfigurationException e) {
            LOG.errorf("No signing key available: %s", e.getMessage());
        }
    }

    /**
     * Generate new signing material for the configured algorithm and make it current.
     *
     * @return the new key id
     * @throws ConfigurationException if the configured algorithm is not supported
     */
    public String rotate() {
        final var algorithm = KeyAlgorithm.fromName(configuredAlgorithm);
        synchronized (rotationLock) {
            final var previous = state;
            final var keyId = nextKeyId(previous.keys());
            final var key = generate(keyId, algorithm);

            final var keys = new LinkedHashMap<>(previous.keys());
            if (previous.current() != null) {
                keys.put(previous.current().keyId(), previous.current().deactivate());
            }
            keys.put(keyId, key);
            state = new KeyState(key, Map.copyOf(keys));
            usage.putIfAbsent(keyId, new AtomicLong());

            LOG.infof(
                    "Signing key rotated: %s (%s), previous: %s",
                    keyId,
                    algorithm,
                    previous.current() != null ? previous.current().keyId() : "none");
            return keyId;
        }
    }

    /**
     * The key that signs new tokens.
     *
     * @throws ConfigurationException if no key could be generated
     */
    public SigningKey currentSigningKey() {
        final var current = state.current();
        if (current == null) {
            throw new ConfigurationException("No signing key available");
        }
        return current;
    }

    /**
     * The key with the given id, falling back to the current key when the id
     * is unknown or null. A token signed by a key this instance never held
     * then fails signature verification downstream.
     */
    public SigningKey verificationKey(String keyId) {
        if (keyId != null) {
            final var key = state.keys().get(keyId);
            if (key != null) {
                return key;
            }
            LOG.debugf("Unknown key id %s, falling back to current key", keyId);
        }
        return currentSigningKey();
    }

    public Optional<SigningKey> findKey(String keyId) {
        return Optional.ofNullable(state.keys().get(keyId));
    }

    /**
     * All keys, oldest first.
     */
    public List<SigningKey> keys() {
        final var keys = new ArrayList<>(state.keys().values());
        keys.sort(Comparator.comparing(SigningKey::createdAt).thenComparing(SigningKey::keyId));
        return keys;
    }

    void recordSignature(String keyId) {
        usage.computeIfAbsent(keyId, id -> new AtomicLong()).incrementAndGet();
    }

    /**
     * Number of tokens signed with a key.
     */
    public long usageCount(String keyId) {
        final var counter = usage.get(keyId);
        return counter != null ? counter.get() : 0;
    }

    /**
     * JWK representations of every RSA verification key, for downstream verifiers.
     * Empty for symmetric algorithms.
     */
    public List<Map<String, Object>> publicKeys() {
        final var jwks = new ArrayList<Map<String, Object>>();
        for (SigningKey key : keys()) {
            if (key.verificationKey() instanceof RSAPublicKey rsa) {
                final var jwk = new HashMap<String, Object>();
                jwk.put("kid", key.keyId());
                jwk.put("kty", "RSA");
                jwk.put("alg", key.algorithm().name());
                jwk.put("use", "sig");
                jwk.put("n", base64Url(rsa.getModulus()));
                jwk.put("e", base64Url(rsa.getPublicExponent()));
                jwks.add(jwk);
            }
        }
        return jwks;
    }

    private String nextKeyId(Map<String, SigningKey> existing) {
        final var base = "key_" + clock.instant().getEpochSecond();
        var candidate = base;
        var suffix = 1;
        while (existing.containsKey(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private SigningKey generate(String keyId, KeyAlgorithm algorithm) {
        final var now = clock.instant();
        if (algorithm.family() == KeyAlgorithm.Family.SYMMETRIC) {
            final var secret = new byte[HMAC_SECRET_BYTES];
            random.nextBytes(secret);
            final var key = new SecretKeySpec(secret, algorithm.jcaName());
            return new SigningKey(keyId, algorithm, key, key, true, now);
        }
        try {
            final var generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(keySize, random);
            final var pair = generator.generateKeyPair();
            return new SigningKey(keyId, algorithm, pair.getPrivate(), pair.getPublic(), true, now);
        } catch (NoSuchAlgorithmException | IllegalArgumentException e) {
            throw new ConfigurationException("Cannot generate RSA key pair: " + e.getMessage(), e);
        }
    }

    private static String base64Url(BigInteger value) {
        var bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            final var trimmed = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, trimmed, 0, trimmed.length);
            bytes = trimmed;
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
