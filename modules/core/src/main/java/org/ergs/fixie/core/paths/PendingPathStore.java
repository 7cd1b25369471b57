package org.ergs.fixie.core.paths;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.ergs.fixie.core.config.FixieConfig;
import org.ergs.fixie.util.AtomicFiles;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Pending registrations: one JSON descriptor per file, named
 * {@code {user}-{token}-pending-path.json}, next to the registries.
 *
 * <p>Writers install descriptors atomically through {@link #register}.
 * Descriptors that cannot be parsed are left on disk and skipped, since a
 * foreign writer may still be producing them.
 */
@ApplicationScoped
public class PendingPathStore {

    private static final Logger log = Logger.getLogger(PendingPathStore.class);

    static final String PENDING_SUFFIX_STEM = "-pending-path";
    static final String PENDING_SUFFIX = PENDING_SUFFIX_STEM + RegistryStore.REGISTRY_SUFFIX;

    /** A descriptor together with the file it was read from. */
    public record PendingRecord(Path file, PendingPath path) {}

    private final Path pathsDir;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    @Inject
    public PendingPathStore(FixieConfig config, ObjectMapper objectMapper) {
        this.pathsDir = config.pathsDir();
        this.reader = objectMapper.readerFor(PendingPath.class)
                .with(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS);
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    /**
     * Readable descriptors waiting for {@code user}, in file-name order.
     * Descriptors naming a different user are left for that user.
     */
    public List<PendingRecord> pending(String user) {
        List<PendingRecord> records = new ArrayList<>();
        for (Path file : candidates(user)) {
            Optional<PendingPath> record = read(file);
            if (record.isEmpty()) {
                continue;
            }
            String owner = record.get().user();
            if (owner != null && !owner.equals(user)) {
                log.debugf("Pending record %s belongs to %s, not %s", file, owner, user);
                continue;
            }
            records.add(new PendingRecord(file, record.get()));
        }
        return records;
    }

    List<Path> candidates(String user) {
        RegistryStore.checkUser(user);
        if (!Files.isDirectory(pathsDir)) {
            return List.of();
        }
        String prefix = user + "-";
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(pathsDir, "*" + PENDING_SUFFIX)) {
            for (Path file : entries) {
                if (file.getFileName().toString().startsWith(prefix)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new RegistryException("Failed to list pending records in " + pathsDir, e);
        }
        Collections.sort(files);
        return files;
    }

    /**
     * Parses one descriptor. Returns empty when the file vanished, cannot be
     * parsed, or lacks a path or holding.
     */
    public Optional<PendingPath> read(Path file) {
        PendingPath record;
        try {
            record = reader.readValue(file.toFile());
        } catch (IOException e) {
            if (Files.exists(file)) {
                log.warnf("Skipping unreadable pending record %s: %s", file, e.getMessage());
            }
            return Optional.empty();
        }
        if (record == null || record.path() == null || record.path().isEmpty()) {
            log.warnf("Skipping pending record %s: no path", file);
            return Optional.empty();
        }
        if (record.holding() == null) {
            log.warnf("Skipping pending record %s: no holding", file);
            return Optional.empty();
        }
        return Optional.of(record);
    }

    /**
     * Drops a new descriptor for {@code record.user()} under a fresh token.
     *
     * @return the descriptor file
     * @throws RegistryException if the descriptor cannot be written
     */
    public Path register(PendingPath record) {
        if (record.user() == null || record.path() == null || record.holding() == null) {
            throw new IllegalArgumentException("pending record needs user, path and holding: " + record);
        }
        RegistryStore.checkUser(record.user());
        Path file = pathsDir.resolve(record.user() + "-" + UUID.randomUUID() + PENDING_SUFFIX);
        try {
            AtomicFiles.write(file, writer.writeValueAsBytes(record));
        } catch (IOException e) {
            throw new RegistryException("Failed to write pending record " + file, e);
        }
        log.debugf("Registered pending path %s for %s at %s", record.path(), record.user(), file);
        return file;
    }

    /** Deletes a consumed descriptor; failures are logged and reported as false. */
    public boolean remove(Path file) {
        try {
            Files.deleteIfExists(file);
            return true;
        } catch (IOException e) {
            log.warnf(e, "Failed to remove pending record %s", file);
            return false;
        }
    }

    public static boolean isPendingFile(Path file) {
        return file.getFileName().toString().endsWith(PENDING_SUFFIX);
    }
}
