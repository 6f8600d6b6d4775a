package taxpoynt.core.model.auth;

/**
 * A user resolved from credentials.
 *
 * @param userId user id
 * @param username login name
 * @param tenantId tenant (nullable)
 */
public record UserIdentity(String userId, String username, String tenantId) {

    public UserIdentity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
    }
}
