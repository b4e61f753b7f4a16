package matriarch.adapter.out.cache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import matriarch.core.model.cache.CacheEntry;
import matriarch.core.model.cache.CacheKey;
import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.port.out.DirectoryCache;

/**
 * Directory cache persisted as one JSON file per entry, reused across runs.
 *
 * <p>Writes go to a temporary file that is then moved over the entry's file, so
 * a reader sees either the old entry or the new one. Expired, unreadable and
 * malformed files are misses. File I/O runs on the worker pool.
 */
public class FileDirectoryCache implements DirectoryCache {

    private static final Logger LOG = Logger.getLogger(FileDirectoryCache.class);
    private static final String SUFFIX = ".json";

    private static final TypeReference<List<DirectoryGroup>> GROUPS = new TypeReference<>() {};
    private static final TypeReference<List<RoleAssignment>> ROLE_ASSIGNMENTS = new TypeReference<>() {};
    private static final TypeReference<List<ApiPermission>> API_PERMISSIONS = new TypeReference<>() {};

    private final Path directory;
    private final Duration ttl;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileDirectoryCache(Path directory, Duration ttl, ObjectMapper objectMapper) {
        this(directory, ttl, objectMapper, Clock.systemUTC());
    }

    FileDirectoryCache(Path directory, Duration ttl, ObjectMapper objectMapper, Clock clock) {
        this.directory = directory;
        this.ttl = ttl;
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + directory, e);
        }
        LOG.infov("Using file cache at {0}", directory.toAbsolutePath());
    }

    @Override
    public Uni<Optional<CacheEntry>> get(CacheKey key) {
        return blocking(() -> read(key));
    }

    @Override
    public Uni<Void> put(CacheKey key, CacheEntry entry) {
        return blocking(() -> {
            write(key, entry);
            return null;
        });
    }

    @Override
    public Uni<Void> invalidate(CacheKey key) {
        return blocking(() -> {
            deleteQuietly(fileFor(key));
            return null;
        });
    }

    @Override
    public Uni<Void> invalidateAll() {
        return blocking(() -> {
            try (Stream<Path> files = Files.list(directory)) {
                files.filter(file -> file.getFileName().toString().endsWith(SUFFIX))
                        .forEach(this::deleteQuietly);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list cache directory " + directory, e);
            }
            return null;
        });
    }

    private Optional<CacheEntry> read(CacheKey key) {
        final var file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            final var root = objectMapper.readTree(file.toFile());
            final var fetchedAt = Instant.ofEpochMilli(root.path("fetchedAt").asLong());
            final var entry = new CacheEntry(decode(key, root.get("value")), fetchedAt);
            if (!entry.isFresh(ttl, clock.instant())) {
                LOG.debugf("Cache file for %s is stale", key.asString());
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warnv("Ignoring unreadable cache file {0}: {1}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(CacheKey key, CacheEntry entry) {
        final ObjectNode root = objectMapper.createObjectNode();
        root.put("principalId", key.principalId());
        root.put("kind", key.kind().name());
        root.put("fetchedAt", entry.fetchedAt().toEpochMilli());
        root.set("value", encode(entry.value()));

        final var target = fileFor(key);
        try {
            final var temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), root);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write cache file " + target, e);
        }
    }

    private JsonNode encode(Object value) {
        if (value instanceof Optional<?> optional) {
            return optional.<JsonNode>map(objectMapper::valueToTree)
                    .orElseGet(NullNode::getInstance);
        }
        return objectMapper.valueToTree(value);
    }

    private Object decode(CacheKey key, JsonNode value) {
        if (value == null) {
            throw new IllegalArgumentException("Cache file for " + key.asString() + " has no value");
        }
        return switch (key.kind()) {
            case PRINCIPAL -> value.isNull()
                    ? Optional.empty()
                    : Optional.of(objectMapper.convertValue(value, Identity.class));
            case MEMBERSHIPS -> objectMapper.convertValue(value, GROUPS);
            case ROLE_ASSIGNMENTS -> objectMapper.convertValue(value, ROLE_ASSIGNMENTS);
            case API_PERMISSIONS -> objectMapper.convertValue(value, API_PERMISSIONS);
        };
    }

    /**
     * One file per key. The principal id is hex encoded so distinct ids never share
     * a file, even on case-insensitive file systems.
     */
    Path fileFor(CacheKey key) {
        final var encodedId = HexFormat.of().formatHex(key.principalId().getBytes(StandardCharsets.UTF_8));
        return directory.resolve(key.kind().name().toLowerCase(Locale.ROOT) + "_" + encodedId + SUFFIX);
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warnv("Cannot delete cache file {0}: {1}", file, e.getMessage());
        }
    }

    private static <T> Uni<T> blocking(Supplier<T> work) {
        return Uni.createFrom().item(work).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }
}
