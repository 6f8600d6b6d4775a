package taxpoynt.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Intervals of the background sweeps.
 *
 * <p>Configuration prefix: {@code taxpoynt.maintenance}
 */
@ConfigMapping(prefix = "taxpoynt.maintenance")
public interface MaintenanceConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * How often the Quarkus scheduler ticks the maintenance scheduler, in the
     * scheduler's {@code every} syntax.
     */
    @WithDefault("1m")
    String tickInterval();

    @WithDefault("PT1H")
    Duration tokenSweepInterval();

    @WithDefault("PT30M")
    Duration tokenCacheSweepInterval();

    @WithDefault("PT5M")
    Duration sessionSweepInterval();

    @WithDefault("PT15M")
    Duration securityMonitorInterval();

    @WithDefault("PT1H")
    Duration activitySweepInterval();

    @WithDefault("PT5M")
    Duration permissionCacheSweepInterval();
}
