package taxpoynt.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import taxpoynt.core.service.storage.AuthStorageProviderRegistry;

/**
 * Readiness of the selected authentication storage provider.
 *
 * <p>Providers without their own health check are reported UP with their name.
 */
@Readiness
@ApplicationScoped
public class AuthStorageHealthCheck implements HealthCheck {

    private final AuthStorageProviderRegistry registry;

    @Inject
    public AuthStorageHealthCheck(AuthStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final var provider = registry.selectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named("auth-storage")
                        .up()
                        .withData("provider", provider.name())
                        .build());
    }
}
