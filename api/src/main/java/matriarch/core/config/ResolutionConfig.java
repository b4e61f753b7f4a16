package matriarch.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for identity resolution.
 *
 * <p>Configuration prefix: {@code matriarch.resolution}
 */
@ConfigMapping(prefix = "matriarch.resolution")
public interface ResolutionConfig {

    /**
     * Upper bound on a single resolution, all retries and delays included.
     *
     * @return resolution timeout (default: 2 minutes)
     */
    @WithDefault("PT2M")
    Duration timeout();
}
