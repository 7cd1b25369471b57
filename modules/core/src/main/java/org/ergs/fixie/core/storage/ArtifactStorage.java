package org.ergs.fixie.core.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.ergs.fixie.core.config.FixieConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Optional;

/**
 * Filesystem access to the artifacts that registry entries reference.
 *
 * <p>Entries hold absolute artifact locations. Only artifacts under the
 * artifact root ({@code fixie.sims.dir}) can be handed out as retrieval
 * references, and references are resolved back against that root.
 */
@ApplicationScoped
public class ArtifactStorage {

    private final Path root;

    @Inject
    public ArtifactStorage(FixieConfig config) {
        this.root = config.simsDir();
    }

    /**
     * Resolves an entry's {@code file} field.
     *
     * @throws ArtifactException if the location is not a valid path
     */
    public Path resolve(String file) {
        try {
            return root.resolve(file).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ArtifactException("Invalid artifact location: " + file, e);
        }
    }

    /** Whether the artifact exists as a regular file. */
    public boolean exists(Path artifact) {
        return Files.isRegularFile(artifact);
    }

    /**
     * Reads the full content of an artifact.
     *
     * @throws ArtifactException if the artifact is missing or unreadable
     */
    public byte[] read(Path artifact) {
        if (!exists(artifact)) {
            throw new ArtifactException(artifact + " does not exist or is not a file");
        }
        try {
            return Files.readAllBytes(artifact);
        } catch (IOException e) {
            throw new ArtifactException("Failed to read " + artifact + ": " + e.getMessage(), e);
        }
    }

    /**
     * Deletes an artifact.
     *
     * @throws ArtifactException if the artifact is missing or cannot be deleted
     */
    public void delete(Path artifact) {
        try {
            Files.delete(artifact);
        } catch (IOException e) {
            throw new ArtifactException("Failed to delete " + artifact + ": " + e, e);
        }
    }

    /**
     * On-disk creation time of an artifact, or empty if it cannot be stat'ed.
     * Filesystems without birth times report the last-modified time.
     */
    public Optional<Instant> creationTime(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return Optional.of(attrs.creationTime().toInstant());
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    /**
     * Retrieval reference for an artifact: its path relative to the root,
     * with {@code /} separators.
     *
     * @throws ArtifactException if the artifact lies outside the root
     */
    public String reference(Path artifact) {
        Path normalized = artifact.toAbsolutePath().normalize();
        if (!normalized.startsWith(root) || normalized.equals(root)) {
            throw new ArtifactException(artifact + " is not under the artifact root " + root);
        }
        return root.relativize(normalized).toString().replace(root.getFileSystem().getSeparator(), "/");
    }

    /**
     * Resolves a retrieval reference back to an artifact, rejecting absolute
     * references and ones that escape the root. An existing target is checked
     * by its real path, so symbolic links cannot lead out of the root.
     *
     * @throws ArtifactException if the reference is not confined to the root
     */
    public Path resolveReference(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new ArtifactException("Empty artifact reference");
        }
        Path relative;
        try {
            relative = Path.of(reference);
        } catch (InvalidPathException e) {
            throw new ArtifactException("Invalid artifact reference: " + reference, e);
        }
        if (relative.isAbsolute() || reference.startsWith("/")) {
            throw new ArtifactException("Artifact reference must be relative: " + reference);
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new ArtifactException("Artifact reference escapes the artifact root: " + reference);
        }
        if (Files.exists(resolved)) {
            checkRealPath(resolved, reference);
        }
        return resolved;
    }

    private void checkRealPath(Path resolved, String reference) {
        try {
            Path realRoot = root.toRealPath();
            Path real = resolved.toRealPath();
            if (!real.startsWith(realRoot) || real.equals(realRoot)) {
                throw new ArtifactException("Artifact reference escapes the artifact root: " + reference);
            }
        } catch (IOException e) {
            throw new ArtifactException("Invalid artifact reference: " + reference, e);
        }
    }
}
