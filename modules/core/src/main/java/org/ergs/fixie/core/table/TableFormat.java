package org.ergs.fixie.core.table;

import java.util.Locale;

/** Shape in which a table is returned to callers. */
public enum TableFormat {
    /** The {@link Table} itself. */
    TABLE,
    /** JSON text. */
    JSON,
    /** The decoded JSON structure: maps and lists. */
    JSON_DICT;

    /**
     * Parses a format name: {@code table} (or {@code pandas}), {@code json},
     * {@code json:dict}. Null selects {@link #TABLE}.
     */
    public static TableFormat fromName(String name) {
        if (name == null) {
            return TABLE;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "table", "pandas" -> TABLE;
            case "json" -> JSON;
            case "json:dict", "json_dict" -> JSON_DICT;
            default -> throw new IllegalArgumentException("Unknown table format: " + name);
        };
    }
}
