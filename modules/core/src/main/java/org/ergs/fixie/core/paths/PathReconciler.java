package org.ergs.fixie.core.paths;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.ergs.fixie.core.lock.RegistryLock;
import org.ergs.fixie.core.paths.PendingPathStore.PendingRecord;
import org.ergs.fixie.core.storage.ArtifactException;
import org.ergs.fixie.core.storage.ArtifactStorage;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges pending registrations into a user's registry.
 *
 * <p>Pending records act as a write-ahead log and the registry file as its
 * compacted state. The whole merge runs under the user's lock: enumerate,
 * load, merge, dump, then delete the consumed records. Any failure before the
 * dump completes leaves every pending record in place, and re-merging a record
 * simply overwrites its path again, so a crash at any point is recoverable.
 */
@ApplicationScoped
public class PathReconciler {

    private static final Logger log = Logger.getLogger(PathReconciler.class);

    private final RegistryStore registryStore;
    private final PendingPathStore pendingStore;
    private final ArtifactStorage artifacts;

    @Inject
    public PathReconciler(RegistryStore registryStore, PendingPathStore pendingStore,
                          ArtifactStorage artifacts) {
        this.registryStore = registryStore;
        this.pendingStore = pendingStore;
        this.artifacts = artifacts;
    }

    /**
     * Reconciles {@code user} and returns the resulting registry.
     * Fails if the lock is busy or the registry cannot be read or written.
     */
    public Outcome<Map<String, PathEntry>> reconcile(String user) {
        Optional<String> invalid = RegistryStore.invalidUser(user);
        if (invalid.isPresent()) {
            return Outcome.failure(invalid.get());
        }
        try (RegistryLock lock = registryStore.lock(user)) {
            return reconcile(user, lock);
        }
    }

    /** Reconciles within a critical section the caller already holds. */
    Outcome<Map<String, PathEntry>> reconcile(String user, RegistryLock lock) {
        if (!lock.isAcquired()) {
            return Outcome.failure(RegistryStore.lockFailureMessage(user));
        }
        List<PendingRecord> pending;
        try {
            pending = pendingStore.pending(user);
        } catch (RegistryException e) {
            return Outcome.failure(e.getMessage());
        }
        if (pending.isEmpty()) {
            return registryStore.read(lock);
        }

        Map<String, PathEntry> incoming = new LinkedHashMap<>();
        for (PendingRecord record : pending) {
            double created = createdTime(record);
            incoming.put(record.path().path(), record.path().toEntry(created));
        }

        Outcome<Map<String, PathEntry>> loaded = registryStore.read(lock);
        if (!loaded.ok()) {
            return loaded;
        }
        Map<String, PathEntry> merged = new LinkedHashMap<>(loaded.value());
        merged.putAll(incoming);

        if (!registryStore.write(lock, merged)) {
            return Outcome.failure("Could not write paths file for user " + user
                    + "; pending paths were kept");
        }
        for (PendingRecord record : pending) {
            pendingStore.remove(record.file());
        }
        log.infof("Reconciled %d pending path(s) for %s", pending.size(), user);
        return Outcome.success(merged, "Paths reconciled");
    }

    private double createdTime(PendingRecord record) {
        Optional<Instant> created = Optional.empty();
        String file = record.path().file();
        if (file != null) {
            try {
                created = artifacts.creationTime(artifacts.resolve(file));
            } catch (ArtifactException e) {
                log.debugf("Unresolvable artifact %s in %s", file, record.file());
            }
        }
        if (created.isEmpty()) {
            Path descriptor = record.file();
            log.warnf("Artifact %s of pending path %s is missing; using the record's own creation time",
                    file, record.path().path());
            created = artifacts.creationTime(descriptor);
        }
        return created.map(PathReconciler::epochSeconds)
                .orElseGet(() -> epochSeconds(Instant.now()));
    }

    static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }
}
