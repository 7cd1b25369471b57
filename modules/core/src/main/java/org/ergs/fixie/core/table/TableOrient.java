package org.ergs.fixie.core.table;

import java.util.Locale;

/**
 * Layout of a table rendered as JSON.
 * <ul>
 *   <li>{@code split}: {@code {columns, index, data}}</li>
 *   <li>{@code records}: a list of column-to-value objects</li>
 *   <li>{@code index}: row index to a column-to-value object</li>
 *   <li>{@code columns}: column to a row-index-to-value object</li>
 *   <li>{@code values}: a list of row value lists</li>
 * </ul>
 */
public enum TableOrient {
    SPLIT, RECORDS, INDEX, COLUMNS, VALUES;

    /** Parses an orient name; null selects {@link #COLUMNS}. */
    public static TableOrient fromName(String name) {
        if (name == null) {
            return COLUMNS;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown table orient: " + name, e);
        }
    }
}
