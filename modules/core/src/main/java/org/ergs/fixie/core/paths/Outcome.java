package org.ergs.fixie.core.paths;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a registry operation: payload (null on failure), success flag and
 * a human-readable message.
 *
 * <p>Expected failures (busy lock, unknown path, I/O errors on artifacts,
 * corrupt registry data) are reported through this type and never thrown
 * across the core boundary.
 */
public record Outcome<T>(T value, boolean ok, String message) {

    public Outcome {
        Objects.requireNonNull(message, "message cannot be null");
    }

    public static <T> Outcome<T> success(T value, String message) {
        return new Outcome<>(value, true, message);
    }

    public static <T> Outcome<T> failure(String message) {
        return new Outcome<>(null, false, message);
    }

    /** Re-types a failed outcome, keeping its message. */
    public <U> Outcome<U> propagate() {
        if (ok) {
            throw new IllegalStateException("Cannot propagate a successful outcome");
        }
        return failure(message);
    }

    public <U> Outcome<U> map(Function<? super T, ? extends U> fn, String successMessage) {
        return ok ? success(fn.apply(value), successMessage) : propagate();
    }
}
