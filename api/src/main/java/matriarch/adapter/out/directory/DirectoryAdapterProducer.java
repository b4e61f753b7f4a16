package matriarch.adapter.out.directory;

import java.nio.file.Path;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.runtime.StartupEvent;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import matriarch.adapter.out.cache.FileDirectoryCache;
import matriarch.adapter.out.cache.LocalDirectoryCache;
import matriarch.adapter.out.cache.NoOpDirectoryCache;
import matriarch.adapter.out.graph.GraphDirectoryClient;
import matriarch.adapter.out.memory.InMemoryDirectoryClient;
import matriarch.core.config.CacheConfig;
import matriarch.core.config.DirectoryConfig;
import matriarch.core.config.ParallelizationConfig;
import matriarch.core.config.ParallelizationSettings;
import matriarch.core.port.out.DirectoryCache;
import matriarch.core.port.out.DirectoryClient;

/**
 * Produces the directory client, the directory cache and the validated
 * parallelization settings for injection into core services.
 *
 * <p>Adapter selection:
 * <ul>
 *   <li>{@code matriarch.directory.provider}: {@code graph} or {@code memory}</li>
 *   <li>{@code matriarch.cache.enabled=false}: no caching</li>
 *   <li>{@code matriarch.cache.directory} set: file cache in that directory</li>
 *   <li>otherwise: in-memory cache</li>
 * </ul>
 *
 * <p>Settings are validated on startup so a bad value stops the application
 * before the first resolution.
 */
@ApplicationScoped
public class DirectoryAdapterProducer {

    private static final Logger LOG = Logger.getLogger(DirectoryAdapterProducer.class);

    static final String GRAPH = "graph";
    static final String MEMORY = "memory";

    private final DirectoryConfig directoryConfig;
    private final CacheConfig cacheConfig;
    private final ParallelizationConfig parallelizationConfig;
    private final Vertx vertx;
    private final ObjectMapper objectMapper;

    @Inject
    public DirectoryAdapterProducer(
            DirectoryConfig directoryConfig,
            CacheConfig cacheConfig,
            ParallelizationConfig parallelizationConfig,
            Vertx vertx,
            ObjectMapper objectMapper) {
        this.directoryConfig = directoryConfig;
        this.cacheConfig = cacheConfig;
        this.parallelizationConfig = parallelizationConfig;
        this.vertx = vertx;
        this.objectMapper = objectMapper;
    }

    void onStart(@Observes StartupEvent event) {
        final var settings = ParallelizationSettings.from(parallelizationConfig);
        LOG.infof(
                "Directory provider: %s, cache: %s, parallelization: %s",
                directoryConfig.provider(), describeCache(), settings);
    }

    @Produces
    @Singleton
    public ParallelizationSettings parallelizationSettings() {
        return ParallelizationSettings.from(parallelizationConfig);
    }

    @Produces
    @ApplicationScoped
    public DirectoryClient directoryClient(ParallelizationSettings settings) {
        final var provider = directoryConfig.provider().trim().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case GRAPH -> new GraphDirectoryClient(vertx, directoryConfig, settings.maxDegreeOfParallelism());
            case MEMORY -> {
                LOG.warn("Using the in-memory directory; resolutions only see principals registered in-process");
                yield new InMemoryDirectoryClient(directoryConfig.searchLimit());
            }
            default -> throw new DirectoryProviderException("Unknown directory provider: " + provider
                    + ". Available: " + GRAPH + ", " + MEMORY);
        };
    }

    @Produces
    @ApplicationScoped
    public DirectoryCache directoryCache() {
        if (!cacheConfig.enabled()) {
            return NoOpDirectoryCache.INSTANCE;
        }
        if (cacheConfig.directory().isPresent()) {
            return new FileDirectoryCache(Path.of(cacheConfig.directory().get()), cacheConfig.ttl(), objectMapper);
        }
        return new LocalDirectoryCache(cacheConfig.ttl(), cacheConfig.maxEntries(), cacheConfig.jitterFactor());
    }

    private String describeCache() {
        if (!cacheConfig.enabled()) {
            return "disabled";
        }
        return cacheConfig.directory().map(dir -> "file (" + dir + ")").orElse("memory") + ", ttl " + cacheConfig.ttl();
    }
}
