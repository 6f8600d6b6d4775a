package taxpoynt.core.model.token;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of credential a token represents. The wire name is carried in the
 * {@code token_type} claim.
 */
public enum TokenKind {
    ACCESS("access_token"),
    REFRESH("refresh_token"),
    ID("id_token"),
    API_KEY("api_key"),
    SESSION("session_token");

    private final String wireName;

    TokenKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TokenKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(k -> k.wireName.equals(value)).findFirst();
    }
}
