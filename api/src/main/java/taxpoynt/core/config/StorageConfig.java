package taxpoynt.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Storage provider selection.
 *
 * <p>Configuration prefix: {@code taxpoynt.storage}
 */
@ConfigMapping(prefix = "taxpoynt.storage")
public interface StorageConfig {

    /**
     * Name of the preferred storage provider.
     */
    @WithDefault("memory")
    String provider();
}
