package com.winevt.resources.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * SQLite implementation of {@link ResourceDatabaseFile} using the sqlite-jdbc driver.
 * A connection must not be shared between threads.
 */
public class SqliteDatabaseFile implements ResourceDatabaseFile {
    private static final Logger log = LoggerFactory.getLogger(SqliteDatabaseFile.class);

    private static final String HAS_TABLE_QUERY =
            "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?";

    private Connection connection;
    private Path path;
    private boolean readOnly;

    @Override
    public boolean open(Path path, boolean readOnly) {
        if (connection != null) {
            throw new IllegalStateException("Cannot open database already opened.");
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(readOnly);
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + path, config.toProperties());
        } catch (SQLException e) {
            log.debug("Unable to open database: {} - {}", path, e.getMessage());
            return false;
        }

        this.path = path;
        this.readOnly = readOnly;
        return true;
    }

    @Override
    public boolean hasTable(String tableName) {
        ensureOpen("Cannot determine if table exists database not opened.");

        try (PreparedStatement statement = connection.prepareStatement(HAS_TABLE_QUERY)) {
            statement.setString(1, tableName);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to determine if table exists: " + tableName, e);
        }
    }

    @Override
    public Stream<Map<String, Object>> getValues(
            List<String> tableNames, List<String> columnNames, String condition) {
        ensureOpen("Cannot retrieve values database not opened.");

        String sql = "SELECT " + String.join(", ", columnNames)
                + " FROM " + String.join(", ", tableNames)
                + (condition != null && !condition.isEmpty() ? " WHERE " + condition : "");
        log.debug("Querying: {}", sql);

        Statement statement = null;
        ResultSet resultSet;
        try {
            statement = connection.createStatement();
            resultSet = statement.executeQuery(sql);
        } catch (SQLException e) {
            closeStatement(statement);
            throw new ResourceDatabaseException("Unable to query: " + sql, e);
        }

        Statement openStatement = statement;
        Iterator<Map<String, Object>> rows = new RowIterator(resultSet, columnNames);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(rows, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(() -> closeStatement(openStatement));
    }

    @Override
    public boolean isOpen() {
        return connection != null;
    }

    public Path getPath() {
        return path;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public void close() {
        if (connection == null) {
            throw new IllegalStateException("Cannot close database not opened.");
        }
        try {
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
            connection.close();
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to close database: " + path, e);
        } finally {
            connection = null;
            path = null;
        }
    }

    private void ensureOpen(String message) {
        if (connection == null) {
            throw new IllegalStateException(message);
        }
    }

    private void closeStatement(Statement statement) {
        if (statement == null) {
            return;
        }
        try {
            statement.close();
        } catch (SQLException e) {
            log.warn("Error closing statement on database: {}", path, e);
        }
    }

    /**
     * Iterates a result set, reading each row into a column-name keyed map.
     */
    private static final class RowIterator implements Iterator<Map<String, Object>> {
        private final ResultSet resultSet;
        private final List<String> columnNames;
        private Boolean hasNext;

        private RowIterator(ResultSet resultSet, List<String> columnNames) {
            this.resultSet = resultSet;
            this.columnNames = columnNames;
        }

        @Override
        public boolean hasNext() {
            if (hasNext == null) {
                try {
                    hasNext = resultSet.next();
                } catch (SQLException e) {
                    throw new ResourceDatabaseException("Unable to fetch row", e);
                }
            }
            return hasNext;
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            hasNext = null;
            Map<String, Object> row = new LinkedHashMap<>();
            try {
                for (int i = 0; i < columnNames.size(); i++) {
                    row.put(columnNames.get(i), resultSet.getObject(i + 1));
                }
            } catch (SQLException e) {
                throw new ResourceDatabaseException("Unable to read row", e);
            }
            return row;
        }
    }
}
