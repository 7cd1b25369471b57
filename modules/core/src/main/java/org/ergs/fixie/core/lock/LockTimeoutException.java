package org.ergs.fixie.core.lock;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Thrown by a hard-fail acquisition when the lock could not be obtained in time.
 */
public class LockTimeoutException extends RuntimeException {

    private final Path resource;

    public LockTimeoutException(Path resource, Duration timeout) {
        super("Could not acquire lock on " + resource + " within " + timeout);
        this.resource = resource;
    }

    public Path resource() {
        return resource;
    }
}
