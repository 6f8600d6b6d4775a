package taxpoynt.core.model.token;

import java.util.Locale;

import taxpoynt.core.model.error.ConfigurationException;

/**
 * Signing algorithms supported for issued tokens.
 */
public enum KeyAlgorithm {
    HS256(Family.SYMMETRIC, "HmacSHA256"),
    HS384(Family.SYMMETRIC, "HmacSHA384"),
    HS512(Family.SYMMETRIC, "HmacSHA512"),
    RS256(Family.ASYMMETRIC, "SHA256withRSA"),
    RS384(Family.ASYMMETRIC, "SHA384withRSA"),
    RS512(Family.ASYMMETRIC, "SHA512withRSA");

    /** Key material family. */
    public enum Family {
        SYMMETRIC,
        ASYMMETRIC
    }

    private final Family family;
    private final String jcaName;

    KeyAlgorithm(Family family, String jcaName) {
        this.family = family;
        this.jcaName = jcaName;
    }

    public Family family() {
        return family;
    }

    public String jcaName() {
        return jcaName;
    }

    /**
     * Resolve an algorithm by its JOSE name (e.g. {@code RS256}).
     *
     * @throws ConfigurationException if the name is not a supported algorithm
     */
    public static KeyAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Signing algorithm is not configured");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported algorithm: " + name, e);
        }
    }
}
