package matriarch.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import matriarch.core.config.DirectoryConfig;
import matriarch.core.service.resolution.CachingDirectoryAccess;
import matriarch.core.service.resolution.RequestBulkhead;

/**
 * Readiness check reporting the directory adapter, the cache mode and bulkhead occupancy.
 *
 * <p>Always UP once configuration has loaded. Directory faults are per-request
 * and surface through retries and metrics, not through readiness.
 */
@Readiness
@ApplicationScoped
public class DirectoryHealthCheck implements HealthCheck {

    private final DirectoryConfig directoryConfig;
    private final CachingDirectoryAccess directoryAccess;
    private final RequestBulkhead bulkhead;

    @Inject
    public DirectoryHealthCheck(
            DirectoryConfig directoryConfig, CachingDirectoryAccess directoryAccess, RequestBulkhead bulkhead) {
        this.directoryConfig = directoryConfig;
        this.directoryAccess = directoryAccess;
        this.bulkhead = bulkhead;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.builder()
                .name("directory")
                .withData("provider", directoryConfig.provider())
                .withData("cache.enabled", directoryAccess.isCachingEnabled())
                .withData("bulkhead.limit", bulkhead.limit())
                .withData("bulkhead.in_flight", bulkhead.inFlight())
                .withData("bulkhead.waiting", bulkhead.waiting())
                .up()
                .build();
    }
}
