package taxpoynt.core.service.storage;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import taxpoynt.core.config.StorageConfig;
import taxpoynt.spi.AuthStorageProvider;
import taxpoynt.spi.StorageProviderException;

/**
 * Selects the authentication storage provider.
 *
 * <p>The configured provider wins when it is available; otherwise the
 * highest-priority available provider is used.
 */
@ApplicationScoped
public class AuthStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(AuthStorageProviderRegistry.class);

    private final List<AuthStorageProvider> providers;
    private final String configuredProvider;

    private volatile AuthStorageProvider selected;

    @Inject
    public AuthStorageProviderRegistry(Instance<AuthStorageProvider> providers, StorageConfig config) {
        this(providers.stream().toList(), config.provider());
    }

    public AuthStorageProviderRegistry(List<AuthStorageProvider> providers, String configuredProvider) {
        this.providers = List.copyOf(providers);
        this.configuredProvider = configuredProvider;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infof("Auth storage provider initialized: %s", selectedProvider().name());
    }

    public AuthStorageProvider selectedProvider() {
        var provider = selected;
        if (provider == null) {
            synchronized (this) {
                provider = selected;
                if (provider == null) {
                    provider = selectProvider();
                    selected = provider;
                }
            }
        }
        return provider;
    }

    private AuthStorageProvider selectProvider() {
        final var available = availableProviders();
        LOG.debugf(
                "Available auth storage providers: %s",
                available.stream().map(AuthStorageProvider::name).toList());

        final var configured = available.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            LOG.infof("Using configured auth storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (configuredProvider != null && !configuredProvider.equals("memory")) {
            LOG.warnf("Configured auth storage provider '%s' is not available, falling back", configuredProvider);
        }
        if (available.isEmpty()) {
            throw new StorageProviderException("No auth storage providers available");
        }
        final var provider = available.get(0);
        LOG.infof("Using auth storage provider: %s (priority: %d)", provider.name(), provider.priority());
        return provider;
    }

    /**
     * Available providers, highest priority first.
     */
    public List<AuthStorageProvider> availableProviders() {
        return providers.stream()
                .filter(AuthStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(AuthStorageProvider::priority).reversed())
                .toList();
    }
}
