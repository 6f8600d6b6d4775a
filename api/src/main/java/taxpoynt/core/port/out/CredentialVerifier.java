package taxpoynt.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.auth.UserIdentity;

/**
 * Resolves login credentials to a user.
 */
public interface CredentialVerifier {

    /**
     * @return the user, or empty if the credentials are not valid
     */
    Uni<Optional<UserIdentity>> verify(String username, String password);
}
