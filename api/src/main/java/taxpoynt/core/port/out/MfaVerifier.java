package taxpoynt.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Verifies second-factor codes.
 */
public interface MfaVerifier {

    Uni<Boolean> verify(String userId, String code);
}
