package org.ergs.fixie.util;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style glob compiled to a whole-string regular expression.
 *
 * <p>Supported syntax: {@code *} (any run of characters, including {@code /}),
 * {@code ?} (one character), {@code [abc]}, {@code [a-z]} and negated
 * {@code [!abc]} classes. All other characters match literally. Paths are
 * logical keys rather than filesystem paths, so {@code *} does not stop at
 * separators.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    /**
     * Compiles a glob.
     *
     * @throws IllegalArgumentException if the glob is malformed (for example an
     *                                  unterminated or empty character class)
     */
    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob cannot be null");
        return new GlobPattern(glob, Pattern.compile(translate(glob), Pattern.DOTALL));
    }

    /** Tests the whole of {@code candidate} against the glob. */
    public boolean matches(String candidate) {
        return regex.matcher(candidate).matches();
    }

    public String glob() {
        return glob;
    }

    static String translate(String glob) {
        StringBuilder out = new StringBuilder(glob.length() * 2);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> out.append(".*");
                case '?' -> out.append('.');
                case '[' -> i = translateClass(glob, i, out);
                default -> out.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return out.toString();
    }

    // i points just past '['; returns the index just past the closing ']'
    private static int translateClass(String glob, int i, StringBuilder out) {
        int n = glob.length();
        int j = i;
        if (j < n && glob.charAt(j) == '!') {
            j++;
        }
        // a ']' right after the opening bracket is a literal member
        if (j < n && glob.charAt(j) == ']') {
            j++;
        }
        while (j < n && glob.charAt(j) != ']') {
            j++;
        }
        if (j >= n) {
            throw new IllegalArgumentException(
                    "Malformed pattern (unterminated character class): " + glob);
        }

        String body = glob.substring(i, j);
        boolean negate = body.startsWith("!");
        if (negate) {
            body = body.substring(1);
        }
        if (body.isEmpty()) {
            throw new IllegalArgumentException("Malformed pattern (empty character class): " + glob);
        }

        out.append('[');
        if (negate) {
            out.append('^');
        }
        for (int k = 0; k < body.length(); k++) {
            char m = body.charAt(k);
            if (m == '-' && k > 0 && k < body.length() - 1) {
                checkRange(glob, body.charAt(k - 1), body.charAt(k + 1));
                out.append('-');
            } else if (Character.isLetterOrDigit(m)) {
                out.append(m);
            } else {
                out.append('\\').append(m);
            }
        }
        out.append(']');
        return j + 1;
    }

    private static void checkRange(String glob, char from, char to) {
        if (from > to) {
            throw new IllegalArgumentException(
                    "Malformed pattern (reversed range " + from + "-" + to + "): " + glob);
        }
    }

    @Override
    public String toString() {
        return glob;
    }
}
