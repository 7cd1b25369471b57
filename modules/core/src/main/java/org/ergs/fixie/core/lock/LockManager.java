package org.ergs.fixie.core.lock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.ergs.fixie.core.config.FixieConfig;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Advisory, exclusive, per-file locks with a bounded wait.
 *
 * <p>Two layers guard each resource: a fair in-process {@link ReentrantLock}
 * serializes threads of this JVM, and an OS lock on the sidecar file
 * {@code <resource>.lock} serializes cooperating processes. The OS lock is
 * polled until the deadline since {@link FileChannel} offers no timed wait.
 *
 * <p>A thread that already holds the lock for a resource may acquire it again;
 * the nested handle only releases its own hold.
 */
@ApplicationScoped
public class LockManager {

    private static final Logger log = Logger.getLogger(LockManager.class);

    static final String LOCK_SUFFIX = ".lock";
    private static final long POLL_MILLIS = 10;

    private final Duration defaultTimeout;
    private final ConcurrentHashMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Inject
    public LockManager(FixieConfig config) {
        this.defaultTimeout = config.lockTimeout();
    }

    /** Soft-fail acquisition with the configured timeout. */
    public RegistryLock acquire(Path resource) {
        return acquire(resource, defaultTimeout, true);
    }

    /**
     * Acquires the lock guarding {@code resource}.
     *
     * @param softFail on timeout, return a not-acquired handle instead of throwing
     * @throws LockTimeoutException on timeout when {@code softFail} is false
     */
    public RegistryLock acquire(Path resource, Duration timeout, boolean softFail) {
        Path key = resource.toAbsolutePath().normalize();
        long deadline = System.nanoTime() + timeout.toNanos();
        ReentrantLock local = locks.computeIfAbsent(key, k -> new ReentrantLock(true));

        boolean locked;
        try {
            locked = local.tryLock(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            locked = false;
        }
        if (!locked) {
            return timedOut(key, timeout, softFail);
        }
        if (local.getHoldCount() > 1) {
            // the outer handle of this thread already owns the OS lock
            return new RegistryLock(key, local, null, null);
        }

        Path lockFile = key.resolveSibling(key.getFileName() + LOCK_SUFFIX);
        try {
            long left;
            do {
                FileChannel channel = FileChannel.open(lockFile,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                FileLock fileLock = tryLock(channel);
                if (fileLock != null) {
                    return new RegistryLock(key, local, channel, fileLock);
                }
                channel.close();
                left = remaining(deadline);
                if (left > 0) {
                    Thread.sleep(Math.max(1, Math.min(POLL_MILLIS, TimeUnit.NANOSECONDS.toMillis(left))));
                }
            } while (left > 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            local.unlock();
            if (softFail) {
                log.warnf(e, "Failed to open lock file %s", lockFile);
                return RegistryLock.notAcquired(key);
            }
            throw new UncheckedIOException("Failed to open lock file " + lockFile, e);
        } catch (RuntimeException e) {
            local.unlock();
            throw e;
        }
        local.unlock();
        return timedOut(key, timeout, softFail);
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // held through another channel of this JVM
            return null;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    private static RegistryLock timedOut(Path key, Duration timeout, boolean softFail) {
        log.warnf("Timed out after %s waiting for lock on %s", timeout, key);
        if (!softFail) {
            throw new LockTimeoutException(key, timeout);
        }
        return RegistryLock.notAcquired(key);
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }
}
