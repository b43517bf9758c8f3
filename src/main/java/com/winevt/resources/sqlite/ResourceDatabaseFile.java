package com.winevt.resources.sqlite;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Minimal query access to a flat resource database file.
 * All operations except {@link #open(Path, boolean)} fail with {@link IllegalStateException}
 * when the file is not open.
 */
public interface ResourceDatabaseFile extends AutoCloseable {

    /**
     * Opens the database file.
     *
     * @param path     the database file
     * @param readOnly whether only queries are permitted
     * @return true if successful, false if the file could not be opened
     * @throws IllegalStateException if the file is already open
     */
    boolean open(Path path, boolean readOnly);

    /**
     * Determines if a table exists.
     *
     * @param tableName the table name
     * @return true if the table exists
     */
    boolean hasTable(String tableName);

    /**
     * Retrieves values from one or more tables. Rows are fetched lazily; the returned
     * stream must be closed to release the underlying cursor.
     *
     * @param tableNames  table names
     * @param columnNames column names, also the keys of each row map
     * @param condition   raw filter clause such as {@code log_source = 'Application Error'},
     *                    or null for all rows
     * @return stream of rows, each a map from column name to value
     */
    Stream<Map<String, Object>> getValues(List<String> tableNames, List<String> columnNames, String condition);

    boolean isOpen();

    /**
     * Closes the database file.
     *
     * @throws IllegalStateException if the file is not open
     */
    @Override
    void close();
}
