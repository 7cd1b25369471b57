package org.ergs.fixie.util;

import java.util.Locale;
import java.util.Set;

/**
 * Normalizes retention ("holding") durations.
 *
 * <p>Holding values arrive from pending records and registry files either as
 * JSON numbers or as strings. Every value is coerced to a {@code double} number
 * of seconds; the symbolic forms {@code inf}, {@code infinite} and
 * {@code infinity} (case-insensitive, optionally signed with {@code +}) map to
 * {@link Double#POSITIVE_INFINITY}, meaning the entry never expires. A
 * negative holding is accepted and counts as already expired.
 */
public final class Holding {

    /** String form written for an infinite holding. */
    public static final String INFINITE = "inf";

    private static final Set<String> INFINITE_FORMS = Set.of(
            "inf", "+inf", "infinite", "+infinite", "infinity", "+infinity");

    private Holding() {
    }

    /**
     * Coerces a raw holding value to seconds.
     *
     * @param raw a {@link Number} or a {@link CharSequence}
     * @throws IllegalArgumentException if the value is null, not numeric or NaN
     */
    public static double normalize(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("holding is missing");
        }
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof CharSequence cs) {
            value = parse(cs.toString());
        } else {
            throw new IllegalArgumentException(
                    "holding must be a number or string, got: " + raw.getClass().getSimpleName());
        }
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("holding must not be NaN");
        }
        return value;
    }

    private static double parse(String text) {
        String trimmed = text.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (INFINITE_FORMS.contains(lower)) {
            return Double.POSITIVE_INFINITY;
        }
        if (lower.startsWith("-") && !lower.startsWith("-+") && INFINITE_FORMS.contains(lower.substring(1))) {
            return Double.NEGATIVE_INFINITY;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("holding is not a number: '" + text + "'", e);
        }
    }

    public static boolean isInfinite(double holding) {
        return holding == Double.POSITIVE_INFINITY;
    }

    /**
     * Whether an entry created at {@code created} (epoch seconds) has outlived
     * its holding at {@code now}. An infinite holding never expires.
     */
    public static boolean isExpired(double created, double holding, double now) {
        if (isInfinite(holding)) {
            return false;
        }
        return now - created >= holding;
    }
}
