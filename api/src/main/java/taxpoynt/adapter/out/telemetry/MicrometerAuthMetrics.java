package taxpoynt.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import taxpoynt.core.config.MetricsConfig;
import taxpoynt.core.port.out.AuthMetrics;

/**
 * Micrometer implementation of {@link AuthMetrics}.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code taxpoynt.auth.tokens.issued} - tokens issued by kind</li>
 *   <li>{@code taxpoynt.auth.tokens.validations} - validations by outcome and cache use</li>
 *   <li>{@code taxpoynt.auth.tokens.revoked} - revocations by reason</li>
 *   <li>{@code taxpoynt.auth.sessions.created} / {@code .terminated}</li>
 *   <li>{@code taxpoynt.auth.security.violations} - rejected session origins by type</li>
 *   <li>{@code taxpoynt.auth.permissions.evaluations} - permission checks by outcome and cache use</li>
 *   <li>{@code taxpoynt.auth.authentications} - login attempts by outcome</li>
 *   <li>{@code taxpoynt.auth.maintenance.swept} - records affected by background sweeps</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry, MetricsConfig config) {
        this.registry = registry;
        this.enabled = config == null || config.enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordTokenIssued(String kind) {
        increment("taxpoynt.auth.tokens.issued", "Tokens issued", "kind", kind);
    }

    @Override
    public void recordTokenValidation(boolean valid, boolean cacheHit) {
        if (!enabled) {
            return;
        }
        Counter.builder("taxpoynt.auth.tokens.validations")
                .description("Token validations")
                .tag("outcome", valid ? "valid" : "invalid")
                .tag("cache", cacheHit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenRevoked(String reason) {
        increment("taxpoynt.auth.tokens.revoked", "Tokens revoked", "reason", reason);
    }

    @Override
    public void recordSessionCreated(String kind) {
        increment("taxpoynt.auth.sessions.created", "Sessions created", "kind", kind);
    }

    @Override
    public void recordSessionTerminated(String reason) {
        increment("taxpoynt.auth.sessions.terminated", "Sessions terminated", "reason", reason);
    }

    @Override
    public void recordSecurityViolation(String type) {
        increment("taxpoynt.auth.security.violations", "Rejected session origins", "type", type);
    }

    @Override
    public void recordPermissionEvaluation(boolean granted, boolean cacheHit) {
        if (!enabled) {
            return;
        }
        Counter.builder("taxpoynt.auth.permissions.evaluations")
                .description("Permission evaluations")
                .tag("outcome", granted ? "granted" : "denied")
                .tag("cache", cacheHit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthentication(boolean success) {
        increment("taxpoynt.auth.authentications", "Authentication attempts", "outcome",
                success ? "success" : "failure");
    }

    @Override
    public void recordSweep(String task, int affected) {
        if (!enabled || affected <= 0) {
            return;
        }
        Counter.builder("taxpoynt.auth.maintenance.swept")
                .description("Records affected by maintenance sweeps")
                .tag("task", nullSafe(task))
                .register(registry)
                .increment(affected);
    }

    private void increment(String name, String description, String tagKey, String tagValue) {
        if (!enabled) {
            return;
        }
        Counter.builder(name)
                .description(description)
                .tag(tagKey, nullSafe(tagValue))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
