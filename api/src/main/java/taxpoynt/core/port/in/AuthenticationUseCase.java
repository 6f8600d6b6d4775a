package taxpoynt.core.port.in;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import taxpoynt.core.model.auth.OperationResult;

/**
 * Uniform operation dispatch used by the rest of the platform.
 */
public interface AuthenticationUseCase {

    /**
     * Run a named operation.
     *
     * <p>Never fails: every error, including an unknown operation name, is
     * reported as an unsuccessful {@link OperationResult}.
     */
    Uni<OperationResult> handle(String operation, Map<String, Object> payload);
}
