package taxpoynt.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for role management.
 *
 * <p>Configuration prefix: {@code taxpoynt.role}
 */
@ConfigMapping(prefix = "taxpoynt.role")
public interface RoleConfig {

    /**
     * How long a user's resolved role set is cached.
     */
    @WithDefault("PT15M")
    Duration cacheTtl();

    /**
     * Seed the built-in roles and demo users at startup.
     */
    @WithDefault("true")
    boolean seedDefaults();
}
