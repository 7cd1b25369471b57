package org.ergs.fixie.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.ergs.fixie.core.config.FixieConfig;
import org.ergs.fixie.core.lock.LockManager;
import org.ergs.fixie.core.paths.PathEntry;
import org.ergs.fixie.core.paths.PathReconciler;
import org.ergs.fixie.core.paths.PathService;
import org.ergs.fixie.core.paths.PendingPathStore;
import org.ergs.fixie.core.paths.RegistryStore;
import org.ergs.fixie.core.storage.ArtifactStorage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Core components wired by hand over a temporary registry root and artifact root.
 */
public final class RegistryFixture {

    public final FixieConfig config;
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final LockManager lockManager;
    public final RegistryStore registryStore;
    public final PendingPathStore pendingStore;
    public final ArtifactStorage artifacts;
    public final PathReconciler reconciler;
    public final PathService pathService;

    public RegistryFixture(Path root) {
        this(root, Duration.ofSeconds(5));
    }

    public RegistryFixture(Path root, Duration lockTimeout) {
        this.config = FixieConfig.of(root.resolve("paths"), root.resolve("sims")).withLockTimeout(lockTimeout);
        try {
            Files.createDirectories(config.pathsDir());
            Files.createDirectories(config.simsDir());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        this.lockManager = new LockManager(config);
        this.registryStore = new RegistryStore(config, lockManager, objectMapper);
        this.pendingStore = new PendingPathStore(config, objectMapper);
        this.artifacts = new ArtifactStorage(config);
        this.reconciler = new PathReconciler(registryStore, pendingStore, artifacts);
        this.pathService = new PathService(reconciler, registryStore, artifacts, config);
    }

    public Path pathsDir() {
        return config.pathsDir();
    }

    public Path simsDir() {
        return config.simsDir();
    }

    /** Writes an artifact under the artifact root. */
    public Path artifact(String name, String content) throws IOException {
        Path file = simsDir().resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Seeds a registry with three entries, without creating their artifacts:
     * {@code /as} (held forever, {@code 0.txt}), {@code /you} (held 0s,
     * {@code 1.h5}) and {@code /wish} (held 42s from {@code wishCreated}, {@code 2.txt}).
     */
    public Map<String, PathEntry> initUserPaths(String user, double created, double wishCreated) {
        Map<String, PathEntry> paths = new LinkedHashMap<>();
        paths.put("/as", new PathEntry("/as", simsDir().resolve("0.txt").toString(),
                user, "1", created, Double.POSITIVE_INFINITY));
        paths.put("/you", new PathEntry("/you", simsDir().resolve("1.h5").toString(),
                user, "2", created, 0.0));
        paths.put("/wish", new PathEntry("/wish", simsDir().resolve("2.txt").toString(),
                user, "3", wishCreated, 42.0));
        if (!registryStore.dump(user, paths)) {
            throw new IllegalStateException("could not seed registry for " + user);
        }
        return paths;
    }

    /** Drops a raw pending descriptor, the way an external job writer would. */
    public Path pendingJson(String user, String token, String json) throws IOException {
        Path file = pathsDir().resolve(user + "-" + token + "-pending-path.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }
}
