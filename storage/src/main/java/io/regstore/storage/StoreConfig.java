// file: storage/src/main/java/io/regstore/storage/StoreConfig.java
package io.regstore.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of an embedded store.
 * <p>
 * Options:
 *  - path:              directory holding the store files (default: ./regstore.db)
 *  - lockTimeoutMillis: how long opening waits for another handle to release the
 *                       directory lock before failing (default: 5000)
 *  - syncWrites:        fsync on every commit (default: true)
 */
public record StoreConfig(
        Path path,
        Duration lockTimeout,
        boolean syncWrites
) {
    static final String OPT_PATH = "path";
    static final String OPT_LOCK_TIMEOUT = "lockTimeoutMillis";
    static final String OPT_SYNC_WRITES = "syncWrites";

    static final String DEFAULT_PATH = "./regstore.db";
    static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    public StoreConfig {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be > 0");
        }
    }

    public static StoreConfig defaults() {
        return new StoreConfig(Path.of(DEFAULT_PATH), DEFAULT_LOCK_TIMEOUT, true);
    }

    /** Same store with another location; handy for tests. */
    public static StoreConfig at(Path path) {
        return new StoreConfig(path, DEFAULT_LOCK_TIMEOUT, true);
    }

    public StoreConfig withLockTimeout(Duration timeout) {
        return new StoreConfig(path, timeout, syncWrites);
    }

    /**
     * Parse a plugin-style option map. Missing options take their defaults.
     *
     * @throws IllegalArgumentException if an option has the wrong type
     */
    public static StoreConfig fromOptions(Map<String, ?> options) {
        Object path = options.get(OPT_PATH);
        Object timeout = options.get(OPT_LOCK_TIMEOUT);
        Object sync = options.get(OPT_SYNC_WRITES);

        if (path != null && !(path instanceof String)) {
            throw new IllegalArgumentException(OPT_PATH + " must be a string");
        }
        if (timeout != null && !(timeout instanceof Number)) {
            throw new IllegalArgumentException(OPT_LOCK_TIMEOUT + " must be a number");
        }
        if (sync != null && !(sync instanceof Boolean)) {
            throw new IllegalArgumentException(OPT_SYNC_WRITES + " must be a boolean");
        }
        return new StoreConfig(
                Path.of(path == null ? DEFAULT_PATH : (String) path),
                timeout == null ? DEFAULT_LOCK_TIMEOUT : Duration.ofMillis(((Number) timeout).longValue()),
                sync == null || (Boolean) sync
        );
    }

    /** Load options from a JSON object, e.g. {"path": "/var/lib/regstore", "syncWrites": false}. */
    public static StoreConfig fromJsonFile(Path file) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            Map<String, Object> options = mapper.readValue(file.toFile(), new TypeReference<>() {});
            return fromOptions(options);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load StoreConfig from " + file, e);
        }
    }
}
