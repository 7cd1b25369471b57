package org.ergs.fixie.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable runtime configuration shared by every core component.
 *
 * @param pathsDir       registry root: per-user registry files and pending records
 * @param simsDir        artifact root: simulation outputs referenced by entries
 * @param lockTimeout    bounded wait when acquiring a user's registry lock
 * @param fetchUrlPrefix prefix of the retrieval locator returned by reference fetches
 */
public record FixieConfig(Path pathsDir, Path simsDir, Duration lockTimeout, String fetchUrlPrefix) {

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_FETCH_URL_PREFIX = "/fetch?file=";

    public FixieConfig {
        Objects.requireNonNull(pathsDir, "pathsDir cannot be null");
        Objects.requireNonNull(simsDir, "simsDir cannot be null");
        Objects.requireNonNull(lockTimeout, "lockTimeout cannot be null");
        Objects.requireNonNull(fetchUrlPrefix, "fetchUrlPrefix cannot be null");
        if (lockTimeout.isNegative()) {
            throw new IllegalArgumentException("lockTimeout must be >= 0, got: " + lockTimeout);
        }
        pathsDir = pathsDir.toAbsolutePath().normalize();
        simsDir = simsDir.toAbsolutePath().normalize();
    }

    /** Configuration with default lock timeout and locator prefix. */
    public static FixieConfig of(Path pathsDir, Path simsDir) {
        return new FixieConfig(pathsDir, simsDir, DEFAULT_LOCK_TIMEOUT, DEFAULT_FETCH_URL_PREFIX);
    }

    public FixieConfig withLockTimeout(Duration timeout) {
        return new FixieConfig(pathsDir, simsDir, timeout, fetchUrlPrefix);
    }
}
