package org.ergs.fixie.core.paths;

import java.util.List;
import java.util.Objects;

/**
 * Which entries an info query returns. Exactly one selector applies, so a
 * request naming both explicit paths and a pattern is rejected when the
 * selector is built.
 */
public sealed interface PathSelector {

    /** Every entry, sorted by path. */
    record All() implements PathSelector {}

    /** The named paths that exist, in the order given. */
    record ByPaths(List<String> paths) implements PathSelector {
        public ByPaths {
            paths = List.copyOf(paths);
        }
    }

    /** Entries whose whole path matches a shell glob, sorted by path. */
    record ByPattern(String pattern) implements PathSelector {
        public ByPattern {
            Objects.requireNonNull(pattern, "pattern cannot be null");
        }
    }

    static PathSelector all() {
        return new All();
    }

    static PathSelector paths(List<String> paths) {
        return new ByPaths(paths);
    }

    static PathSelector pattern(String pattern) {
        return new ByPattern(pattern);
    }

    /**
     * Builds a selector from optional request fields.
     *
     * @throws IllegalArgumentException if both {@code paths} and {@code pattern} are given
     */
    static PathSelector of(List<String> paths, String pattern) {
        if (paths != null && pattern != null) {
            throw new IllegalArgumentException("paths and pattern are mutually exclusive");
        }
        if (paths != null) {
            return paths(paths);
        }
        if (pattern != null) {
            return pattern(pattern);
        }
        return all();
    }
}
