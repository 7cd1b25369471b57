package org.ergs.fixie.core.table;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads named tables out of artifacts of the file types it supports.
 */
public interface TableReader {

    /** Whether this reader handles artifacts with the given lower-case extension. */
    boolean supports(String extension);

    /**
     * Reads {@code table} from {@code artifact}, keeping only rows matching
     * every condition.
     *
     * @throws TableReadException if the table cannot be read
     */
    Table read(Path artifact, String table, List<Condition> conditions);
}
