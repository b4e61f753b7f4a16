package matriarch.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the directory adapter.
 *
 * <p>Configuration prefix: {@code matriarch.directory}
 *
 * <p>Example configuration:
 * <pre>{@code
 * matriarch.directory.provider=graph
 * matriarch.directory.graph.graph-token=${GRAPH_TOKEN}
 * matriarch.directory.graph.management-token=${ARM_TOKEN}
 * }</pre>
 */
@ConfigMapping(prefix = "matriarch.directory")
public interface DirectoryConfig {

    /**
     * Directory adapter: {@code graph} for Microsoft Graph and Azure Resource Graph,
     * {@code memory} for a local in-memory directory.
     *
     * @return provider name (default: graph)
     */
    @WithDefault("graph")
    String provider();

    /**
     * Maximum results per principal kind for display-name searches.
     *
     * @return search limit (default: 10)
     */
    @WithDefault("10")
    int searchLimit();

    /**
     * Microsoft Graph and Resource Graph settings.
     */
    GraphConfig graph();

    /**
     * Graph adapter settings.
     */
    interface GraphConfig {

        /**
         * Microsoft Graph API root.
         */
        @WithDefault("https://graph.microsoft.com/v1.0")
        String graphBaseUrl();

        /**
         * Azure Resource Manager root, used for Resource Graph queries.
         */
        @WithDefault("https://management.azure.com")
        String managementBaseUrl();

        /**
         * Bearer token for Microsoft Graph.
         */
        Optional<String> graphToken();

        /**
         * Bearer token for Azure Resource Manager.
         */
        Optional<String> managementToken();

        /**
         * Page size for collection queries.
         *
         * @return page size (default: 999)
         */
        @WithDefault("999")
        int pageSize();

        /**
         * Per-request timeout. Expiry counts as a transient failure.
         *
         * @return request timeout (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration requestTimeout();
    }
}
