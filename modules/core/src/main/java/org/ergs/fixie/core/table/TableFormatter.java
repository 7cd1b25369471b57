package org.ergs.fixie.core.table;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Renders a {@link Table} in a requested {@link TableFormat} and {@link TableOrient}.
 */
@ApplicationScoped
public class TableFormatter {

    private final ObjectMapper objectMapper;

    @Inject
    public TableFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the table, a JSON string, or a structure of maps and lists
     * @throws TableReadException if the table cannot be serialized
     */
    public Object format(Table table, TableFormat format, TableOrient orient) {
        if (format == TableFormat.TABLE) {
            return table;
        }
        Object structure = structure(table, orient);
        if (format == TableFormat.JSON_DICT) {
            return structure;
        }
        try {
            return objectMapper.writeValueAsString(structure);
        } catch (JsonProcessingException e) {
            throw new TableReadException("Could not serialize table: " + e.getOriginalMessage(), e);
        }
    }

    static Object structure(Table table, TableOrient orient) {
        return switch (orient) {
            case SPLIT -> {
                Map<String, Object> split = new LinkedHashMap<>();
                split.put("columns", table.columns());
                split.put("index", IntStream.range(0, table.size()).boxed().toList());
                split.put("data", table.rows());
                yield split;
            }
            case RECORDS -> {
                List<Map<String, Object>> records = new ArrayList<>(table.size());
                for (List<Object> row : table.rows()) {
                    records.add(record(table.columns(), row));
                }
                yield records;
            }
            case INDEX -> {
                Map<String, Object> index = new LinkedHashMap<>();
                for (int i = 0; i < table.size(); i++) {
                    index.put(String.valueOf(i), record(table.columns(), table.rows().get(i)));
                }
                yield index;
            }
            case COLUMNS -> {
                Map<String, Object> columns = new LinkedHashMap<>();
                for (int c = 0; c < table.columns().size(); c++) {
                    Map<String, Object> values = new LinkedHashMap<>();
                    for (int i = 0; i < table.size(); i++) {
                        values.put(String.valueOf(i), table.rows().get(i).get(c));
                    }
                    columns.put(table.columns().get(c), values);
                }
                yield columns;
            }
            case VALUES -> table.rows();
        };
    }

    private static Map<String, Object> record(List<String> columns, List<Object> row) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            record.put(columns.get(c), row.get(c));
        }
        return record;
    }
}
