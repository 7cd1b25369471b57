package org.ergs.fixie.core.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rows read from a table inside an artifact. Each row has one value per column,
 * in column order.
 */
public record Table(List<String> columns, List<List<Object>> rows) {

    public Table {
        Objects.requireNonNull(columns, "columns cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");
        columns = List.copyOf(columns);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "row has " + row.size() + " values for " + columns.size() + " columns");
            }
            // rows may carry SQL NULLs, which List.copyOf rejects
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public int size() {
        return rows.size();
    }
}
