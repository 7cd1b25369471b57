package org.ergs.fixie.core.table;

/**
 * Thrown when an artifact cannot be read as a table.
 */
public class TableReadException extends RuntimeException {

    public TableReadException(String message) {
        super(message);
    }

    public TableReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
