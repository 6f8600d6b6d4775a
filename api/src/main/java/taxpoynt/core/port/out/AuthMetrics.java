package taxpoynt.core.port.out;

/**
 * Port for recording authentication metrics.
 */
public interface AuthMetrics {

    void recordTokenIssued(String kind);

    void recordTokenValidation(boolean valid, boolean cacheHit);

    void recordTokenRevoked(String reason);

    void recordSessionCreated(String kind);

    void recordSessionTerminated(String reason);

    void recordSecurityViolation(String type);

    void recordPermissionEvaluation(boolean granted, boolean cacheHit);

    void recordAuthentication(boolean success);

    void recordSweep(String task, int affected);
}
