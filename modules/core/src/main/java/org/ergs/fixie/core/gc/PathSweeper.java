package org.ergs.fixie.core.gc;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.ergs.fixie.core.lock.RegistryLock;
import org.ergs.fixie.core.paths.Outcome;
import org.ergs.fixie.core.paths.PathEntry;
import org.ergs.fixie.core.paths.RegistryException;
import org.ergs.fixie.core.paths.RegistryStore;
import org.ergs.fixie.core.storage.ArtifactException;
import org.ergs.fixie.core.storage.ArtifactStorage;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Deletes artifacts whose holding time has run out and drops their entries.
 *
 * <p>One sweep visits every user registry independently. A user whose lock
 * is busy is skipped with a message; an artifact that cannot be deleted keeps
 * its entry and adds a message. The sweep succeeds only when no message was
 * recorded, but it always visits every user.
 */
@ApplicationScoped
public class PathSweeper {

    private static final Logger log = Logger.getLogger(PathSweeper.class);

    private final RegistryStore registryStore;
    private final ArtifactStorage artifacts;
    private final Clock clock;

    @Inject
    public PathSweeper(RegistryStore registryStore, ArtifactStorage artifacts) {
        this(registryStore, artifacts, Clock.systemUTC());
    }

    public PathSweeper(RegistryStore registryStore, ArtifactStorage artifacts, Clock clock) {
        this.registryStore = registryStore;
        this.artifacts = artifacts;
        this.clock = clock;
    }

    @Scheduled(every = "${fixie.gc.every:1h}", delayed = "${fixie.gc.delay:1m}", concurrentExecution = SKIP)
    void scheduledSweep() {
        Outcome<Void> result = gc();
        if (result.ok()) {
            log.debug("Scheduled sweep completed");
        } else {
            log.warnf("Scheduled sweep finished with problems: %s", result.message());
        }
    }

    /** Sweeps every user registry once. */
    public Outcome<Void> gc() {
        List<String> messages = new ArrayList<>();
        List<Path> registries;
        try {
            registries = registryStore.listRegistryFiles();
        } catch (RegistryException e) {
            return Outcome.failure(e.getMessage());
        }
        for (Path registry : registries) {
            sweep(registry, messages);
        }
        if (messages.isEmpty()) {
            return Outcome.success(null, "Garbage collection complete");
        }
        return Outcome.failure(String.join("\n", messages));
    }

    private void sweep(Path registry, List<String> messages) {
        String user = RegistryStore.userOf(registry);
        try (RegistryLock lock = registryStore.lock(user)) {
            if (!lock.isAcquired()) {
                messages.add("Could not acquire lock on " + registry + ", skipping");
                return;
            }
            Outcome<Map<String, PathEntry>> loaded = registryStore.read(lock);
            if (!loaded.ok()) {
                messages.add(loaded.message());
                return;
            }

            double now = epochSeconds(clock.instant());
            Map<String, PathEntry> kept = new LinkedHashMap<>(loaded.value());
            int removed = 0;
            for (Map.Entry<String, PathEntry> item : loaded.value().entrySet()) {
                PathEntry entry = item.getValue();
                if (!entry.isExpired(now) || entry.file() == null) {
                    continue;
                }
                Path artifact;
                try {
                    artifact = artifacts.resolve(entry.file());
                } catch (ArtifactException e) {
                    messages.add(e.getMessage());
                    continue;
                }
                if (!artifacts.exists(artifact)) {
                    continue;
                }
                try {
                    artifacts.delete(artifact);
                } catch (ArtifactException e) {
                    messages.add(e.getMessage());
                    continue;
                }
                kept.remove(item.getKey());
                removed++;
                log.infof("Expired %s for %s: deleted %s", entry.path(), user, artifact);
            }

            if (removed > 0 && !registryStore.write(lock, kept)) {
                messages.add("Removed " + removed + " expired file(s) for user " + user
                        + ", but paths file could not be updated: the system is in an inconsistent state");
            }
        } catch (IllegalArgumentException e) {
            // a file under the registry root whose name cannot belong to a user
            messages.add("Skipping " + registry + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.errorf(e, "Sweep of %s failed", registry);
            messages.add("Sweep of " + registry + " failed: " + e.getMessage());
        }
    }

    private static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }
}
