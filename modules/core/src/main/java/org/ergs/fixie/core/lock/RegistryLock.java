package org.ergs.fixie.core.lock;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scoped handle for an advisory lock on one registry file.
 *
 * <p>Use in try-with-resources; {@link #close()} releases both the in-process
 * lock and the OS file lock and may be called more than once. A handle for
 * which {@link #isAcquired()} is false holds nothing: callers must not touch
 * the guarded file through it.
 */
public final class RegistryLock implements AutoCloseable {

    private static final Logger log = Logger.getLogger(RegistryLock.class);

    private final Path resource;
    private final ReentrantLock local;
    private final FileChannel channel;
    private final FileLock fileLock;
    private final AtomicBoolean open;

    RegistryLock(Path resource, ReentrantLock local, FileChannel channel, FileLock fileLock) {
        this.resource = resource;
        this.local = local;
        this.channel = channel;
        this.fileLock = fileLock;
        this.open = new AtomicBoolean(local != null);
    }

    static RegistryLock notAcquired(Path resource) {
        return new RegistryLock(resource, null, null, null);
    }

    /** The guarded file (not the sidecar lock file). */
    public Path resource() {
        return resource;
    }

    public boolean isAcquired() {
        return open.get();
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        try {
            if (fileLock != null) {
                fileLock.release();
            }
            if (channel != null) {
                channel.close();
            }
        } catch (IOException e) {
            // closing the process releases the OS lock anyway; the in-process lock must still go
            log.warnf(e, "Failed to release file lock on %s", resource);
        } finally {
            local.unlock();
        }
    }

    @Override
    public String toString() {
        return "RegistryLock[" + resource + (isAcquired() ? ", held" : ", not acquired") + "]";
    }
}
