package taxpoynt.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Metrics recording.
 *
 * <p>Configuration prefix: {@code taxpoynt.metrics}
 */
@ConfigMapping(prefix = "taxpoynt.metrics")
public interface MetricsConfig {

    @WithDefault("true")
    boolean enabled();
}
