package taxpoynt.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for permission evaluation.
 *
 * <p>Configuration prefix: {@code taxpoynt.permission}
 */
@ConfigMapping(prefix = "taxpoynt.permission")
public interface PermissionConfig {

    @WithDefault("PT5M")
    Duration cacheTtl();

    @WithDefault("10000")
    long cacheMaxSize();

    /**
     * Seed the built-in permissions and policies at startup.
     */
    @WithDefault("true")
    boolean seedDefaults();
}
