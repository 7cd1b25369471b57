package org.ergs.fixie.core.paths;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.ergs.fixie.core.config.FixieConfig;
import org.ergs.fixie.core.lock.LockManager;
import org.ergs.fixie.core.lock.RegistryLock;
import org.ergs.fixie.util.AtomicFiles;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Durable per-user registries: one JSON object per user at
 * {@code {pathsDir}/{user}.json}, keyed by path.
 *
 * <p>{@link #load} and {@link #dump} take the user's lock for the duration of
 * the call. {@link #read} and {@link #write} run against a lock the caller
 * already holds, so a load-modify-write sequence can share one critical
 * section.
 */
@ApplicationScoped
public class RegistryStore {

    private static final Logger log = Logger.getLogger(RegistryStore.class);

    static final String REGISTRY_SUFFIX = ".json";

    private final Path pathsDir;
    private final LockManager lockManager;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    @Inject
    public RegistryStore(FixieConfig config, LockManager lockManager, ObjectMapper objectMapper) {
        this.pathsDir = config.pathsDir();
        this.lockManager = lockManager;
        this.reader = objectMapper
                .readerFor(new TypeReference<LinkedHashMap<String, PathEntry>>() {})
                .with(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS);
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    /**
     * Location of a user's registry file.
     *
     * @throws IllegalArgumentException if {@code user} cannot name a registry file
     */
    public Path registryFile(String user) {
        checkUser(user);
        return pathsDir.resolve(user + REGISTRY_SUFFIX);
    }

    /** Acquires the user's registry lock, soft-failing after the configured timeout. */
    public RegistryLock lock(String user) {
        return lockManager.acquire(registryFile(user));
    }

    /**
     * Loads a user's registry under its lock. A missing file is an empty
     * registry; a busy lock or unreadable content is a failure.
     */
    public Outcome<Map<String, PathEntry>> load(String user) {
        try (RegistryLock lock = lock(user)) {
            return read(lock);
        }
    }

    /**
     * Replaces a user's registry under its lock.
     *
     * @return false if the lock could not be acquired or the write failed
     */
    public boolean dump(String user, Map<String, PathEntry> paths) {
        try (RegistryLock lock = lock(user)) {
            return write(lock, paths);
        }
    }

    /** Reads the registry guarded by {@code lock}. */
    public Outcome<Map<String, PathEntry>> read(RegistryLock lock) {
        String user = userOf(lock.resource());
        if (!lock.isAcquired()) {
            return Outcome.failure(lockFailureMessage(user));
        }
        Path file = lock.resource();
        if (!Files.exists(file)) {
            return Outcome.success(new LinkedHashMap<>(), "Paths loaded");
        }
        try {
            Map<String, PathEntry> paths = reader.readValue(file.toFile());
            if (paths == null) {
                throw new RegistryException("registry content is null");
            }
            checkEntries(paths);
            return Outcome.success(paths, "Paths loaded");
        } catch (IOException | RuntimeException e) {
            log.errorf(e, "Corrupt paths file %s", file);
            return Outcome.failure("Paths file for user " + user + " could not be read: "
                    + e.getMessage());
        }
    }

    private static void checkEntries(Map<String, PathEntry> paths) {
        for (Map.Entry<String, PathEntry> item : paths.entrySet()) {
            PathEntry entry = item.getValue();
            if (entry == null) {
                throw new RegistryException("entry for " + item.getKey() + " is null");
            }
            if (!item.getKey().equals(entry.path())) {
                throw new RegistryException("entry for " + item.getKey()
                        + " is registered under path " + entry.path());
            }
        }
    }

    /**
     * Atomically replaces the registry guarded by {@code lock}.
     *
     * @return false if the lock is not held or the write failed
     */
    public boolean write(RegistryLock lock, Map<String, PathEntry> paths) {
        if (!lock.isAcquired()) {
            log.warnf("Refusing to write %s without its lock", lock.resource());
            return false;
        }
        try {
            byte[] json = serialize(paths);
            AtomicFiles.write(lock.resource(), json);
            log.debugf("Wrote %d paths to %s", paths.size(), lock.resource());
            return true;
        } catch (IOException | RuntimeException e) {
            log.errorf(e, "Failed to write paths file %s", lock.resource());
            return false;
        }
    }

    private byte[] serialize(Map<String, PathEntry> paths) throws JsonProcessingException {
        return writer.writeValueAsBytes(new TreeMap<>(paths));
    }

    /** Every per-user registry file under the registry root, sorted by name. */
    public List<Path> listRegistryFiles() {
        if (!Files.isDirectory(pathsDir)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(pathsDir, "*" + REGISTRY_SUFFIX)) {
            for (Path file : entries) {
                if (Files.isRegularFile(file) && !PendingPathStore.isPendingFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new RegistryException("Failed to list registry files in " + pathsDir, e);
        }
        Collections.sort(files);
        return files;
    }

    /** The user owning a registry file. */
    public static String userOf(Path registryFile) {
        String name = registryFile.getFileName().toString();
        return name.endsWith(REGISTRY_SUFFIX)
                ? name.substring(0, name.length() - REGISTRY_SUFFIX.length())
                : name;
    }

    static String lockFailureMessage(String user) {
        return "Could not acquire lock on paths file for user " + user;
    }

    static void checkUser(String user) {
        invalidUser(user).ifPresent(message -> {
            throw new IllegalArgumentException(message);
        });
    }

    /** Why {@code user} cannot name a registry, or empty if it can. */
    public static Optional<String> invalidUser(String user) {
        if (user == null || user.isBlank()) {
            return Optional.of("user cannot be empty");
        }
        if (user.contains("/") || user.contains("\\") || user.startsWith(".")) {
            return Optional.of("user is not a valid name: '" + user + "'");
        }
        if (user.endsWith(PendingPathStore.PENDING_SUFFIX_STEM)) {
            return Optional.of("user name collides with pending records: '" + user + "'");
        }
        return Optional.empty();
    }
}
