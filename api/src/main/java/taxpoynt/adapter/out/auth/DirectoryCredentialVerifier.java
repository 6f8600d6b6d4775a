package taxpoynt.adapter.out.auth;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.model.auth.UserIdentity;
import taxpoynt.core.port.out.CredentialVerifier;
import taxpoynt.core.util.SecureHash;

/**
 * In-memory user directory.
 *
 * <p>Passwords are held as SHA-256 digests and compared in constant time.
 * The directory starts with the platform's two demo accounts.
 */
@ApplicationScoped
public class DirectoryCredentialVerifier implements CredentialVerifier {

    private static final Logger LOG = Logger.getLogger(DirectoryCredentialVerifier.class);

    /**
     * A directory account and the roles it is granted at startup.
     */
    public record DirectoryUser(
            String userId, String username, String tenantId, byte[] passwordDigest, Set<String> initialRoles) {

        public DirectoryUser {
            initialRoles = initialRoles != null ? Set.copyOf(initialRoles) : Set.of();
        }

        UserIdentity identity() {
            return new UserIdentity(userId, username, tenantId);
        }
    }

    private final Map<String, DirectoryUser> users = new ConcurrentHashMap<>();

    public DirectoryCredentialVerifier() {
        addUser("user_admin", "admin@taxpoynt.com", "tenant_platform", "password", Set.of("platform_admin"));
        addUser("user_si_001", "si_user@company.com", "tenant_company_001", "password", Set.of("system_integrator"));
    }

    public void addUser(String userId, String username, String tenantId, String password, Set<String> initialRoles) {
        users.put(username, new DirectoryUser(userId, username, tenantId, SecureHash.sha256(password), initialRoles));
    }

    public List<DirectoryUser> users() {
        return users.values().stream()
                .sorted((a, b) -> a.userId().compareTo(b.userId()))
                .toList();
    }

    @Override
    public Uni<Optional<UserIdentity>> verify(String username, String password) {
        return Uni.createFrom().item(() -> {
            if (username == null || password == null) {
                return Optional.empty();
            }
            final var user = users.get(username);
            if (user == null || !SecureHash.digestEquals(password, user.passwordDigest())) {
                LOG.debugf("Credential check failed for %s", username);
                return Optional.empty();
            }
            return Optional.of(user.identity());
        });
    }
}
