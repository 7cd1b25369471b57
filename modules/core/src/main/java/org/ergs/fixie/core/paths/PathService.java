package org.ergs.fixie.core.paths;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.ergs.fixie.core.config.FixieConfig;
import org.ergs.fixie.core.lock.RegistryLock;
import org.ergs.fixie.core.storage.ArtifactException;
import org.ergs.fixie.core.storage.ArtifactStorage;
import org.ergs.fixie.util.GlobPattern;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * List, info, fetch and delete over a user's reconciled registry.
 *
 * <p>Every operation reconciles pending records first. Failures, including a
 * busy registry lock, come back as unsuccessful {@link Outcome}s.
 */
@ApplicationScoped
public class PathService {

    private static final Logger log = Logger.getLogger(PathService.class);

    private final PathReconciler reconciler;
    private final RegistryStore registryStore;
    private final ArtifactStorage artifacts;
    private final String fetchUrlPrefix;

    @Inject
    public PathService(PathReconciler reconciler, RegistryStore registryStore,
                       ArtifactStorage artifacts, FixieConfig config) {
        this.reconciler = reconciler;
        this.registryStore = registryStore;
        this.artifacts = artifacts;
        this.fetchUrlPrefix = config.fetchUrlPrefix();
    }

    /**
     * All of the user's paths in ascending order, optionally restricted to
     * those whose whole key matches a shell glob.
     */
    public Outcome<List<String>> listPaths(String user, String pattern) {
        GlobPattern glob = null;
        if (pattern != null) {
            try {
                glob = GlobPattern.compile(pattern);
            } catch (IllegalArgumentException e) {
                return Outcome.failure(e.getMessage());
            }
        }
        Outcome<Map<String, PathEntry>> paths = reconciled(user);
        if (!paths.ok()) {
            return paths.propagate();
        }
        List<String> keys = new ArrayList<>();
        for (String key : paths.value().keySet()) {
            if (glob == null || glob.matches(key)) {
                keys.add(key);
            }
        }
        keys.sort(Comparator.naturalOrder());
        return Outcome.success(keys, "Paths listed");
    }

    /**
     * Entry metadata for optional request fields; supplying both
     * {@code paths} and {@code pattern} fails before storage is touched.
     */
    public Outcome<List<PathEntry>> info(String user, List<String> paths, String pattern) {
        PathSelector selector;
        try {
            selector = PathSelector.of(paths, pattern);
        } catch (IllegalArgumentException e) {
            return Outcome.failure(e.getMessage());
        }
        return info(user, selector);
    }

    public Outcome<List<PathEntry>> info(String user, PathSelector selector) {
        GlobPattern glob = null;
        if (selector instanceof PathSelector.ByPattern byPattern) {
            try {
                glob = GlobPattern.compile(byPattern.pattern());
            } catch (IllegalArgumentException e) {
                return Outcome.failure(e.getMessage());
            }
        }
        Outcome<Map<String, PathEntry>> reconciled = reconciled(user);
        if (!reconciled.ok()) {
            return reconciled.propagate();
        }
        Map<String, PathEntry> paths = reconciled.value();

        List<PathEntry> infos = new ArrayList<>();
        if (selector instanceof PathSelector.ByPaths byPaths) {
            for (String path : byPaths.paths()) {
                PathEntry entry = paths.get(path);
                if (entry != null) {
                    infos.add(entry);
                }
            }
        } else {
            for (PathEntry entry : paths.values()) {
                if (glob == null || glob.matches(entry.path())) {
                    infos.add(entry);
                }
            }
            infos.sort(Comparator.comparing(PathEntry::path));
        }
        return Outcome.success(infos, "Info found");
    }

    /**
     * Fetches an artifact's bytes, or with {@code asReference} a retrieval
     * locator relative to the artifact root without reading the file.
     */
    public Outcome<FetchedFile> fetch(String user, String path, boolean asReference) {
        Outcome<Path> artifact = resolveArtifact(user, path);
        if (!artifact.ok()) {
            return artifact.propagate();
        }
        try {
            if (asReference) {
                String locator = fetchUrlPrefix + artifacts.reference(artifact.value());
                return Outcome.success(new FetchedFile.Reference(locator), "File fetched");
            }
            byte[] bytes = artifacts.read(artifact.value());
            return Outcome.success(new FetchedFile.Content(bytes), "File fetched");
        } catch (ArtifactException e) {
            return Outcome.failure("Could not fetch " + path + ": " + e.getMessage());
        }
    }

    /**
     * Deletes the artifact behind {@code path}, then its entry. A failed
     * artifact delete leaves the entry untouched; a failed registry write
     * after the artifact is gone is reported as an inconsistent state.
     */
    public Outcome<Void> delete(String user, String path) {
        Optional<String> invalid = RegistryStore.invalidUser(user);
        if (invalid.isPresent()) {
            return Outcome.failure(invalid.get());
        }
        try (RegistryLock lock = registryStore.lock(user)) {
            Outcome<Map<String, PathEntry>> reconciled = reconciler.reconcile(user, lock);
            if (!reconciled.ok()) {
                return unavailable(reconciled);
            }
            Map<String, PathEntry> paths = new LinkedHashMap<>(reconciled.value());
            Outcome<Path> artifact = locate(paths, path);
            if (!artifact.ok()) {
                return artifact.propagate();
            }
            try {
                artifacts.delete(artifact.value());
            } catch (ArtifactException e) {
                return Outcome.failure("Could not delete " + path + ": " + e.getMessage());
            }
            paths.remove(path);
            if (!registryStore.write(lock, paths)) {
                String message = path + " file was removed, but paths file could not be updated: "
                        + "the system is in an inconsistent state";
                log.error(message);
                return Outcome.failure(message);
            }
            log.infof("Deleted %s (%s) for %s", path, artifact.value(), user);
            return Outcome.success(null, "Path deleted");
        }
    }

    /**
     * Resolves a path to its artifact, failing if the path is unknown, has no
     * file, or the file is missing or not a regular file.
     */
    public Outcome<Path> resolveArtifact(String user, String path) {
        Outcome<Map<String, PathEntry>> paths = reconciled(user);
        if (!paths.ok()) {
            return paths.propagate();
        }
        return locate(paths.value(), path);
    }

    private Outcome<Path> locate(Map<String, PathEntry> paths, String path) {
        PathEntry entry = paths.get(path);
        if (entry == null) {
            return Outcome.failure("Path not found: " + path);
        }
        if (entry.file() == null || entry.file().isEmpty()) {
            return Outcome.failure("Path " + path + " has no file associated with it");
        }
        Path artifact;
        try {
            artifact = artifacts.resolve(entry.file());
        } catch (ArtifactException e) {
            return Outcome.failure(e.getMessage());
        }
        if (!artifacts.exists(artifact)) {
            return Outcome.failure(artifact + " does not exist or is not a file");
        }
        return Outcome.success(artifact, "Path resolved");
    }

    private Outcome<Map<String, PathEntry>> reconciled(String user) {
        Outcome<Map<String, PathEntry>> paths = reconciler.reconcile(user);
        return paths.ok() ? paths : unavailable(paths);
    }

    private static <T> Outcome<T> unavailable(Outcome<?> failed) {
        return Outcome.failure("Paths registry unavailable: " + failed.message());
    }
}
