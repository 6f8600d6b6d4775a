package taxpoynt.adapter.out.auth;

import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.port.out.MfaVerifier;

/**
 * Accepts any six-digit numeric code.
 *
 * <p>Stand-in until a TOTP or SMS provider is registered; replace it with an
 * alternative {@link MfaVerifier} bean.
 */
@ApplicationScoped
public class NumericCodeMfaVerifier implements MfaVerifier {

    private static final Logger LOG = Logger.getLogger(NumericCodeMfaVerifier.class);
    private static final Pattern SIX_DIGITS = Pattern.compile("\\d{6}");

    @Override
    public Uni<Boolean> verify(String userId, String code) {
        return Uni.createFrom().item(() -> {
            final var valid = code != null && SIX_DIGITS.matcher(code).matches();
            if (!valid) {
                LOG.debugf("MFA code rejected for %s", userId);
            }
            return valid;
        });
    }
}
