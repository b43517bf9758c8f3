package com.winevt.resources.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.winevt.resources.sqlite.ResourceDatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * SQLite-backed attribute container store.
 *
 * <p>Each registered container type is stored in a table named after the type, with an
 * {@code _identifier} primary key holding the sequence number and one column per schema
 * attribute. List attributes are serialized as JSON. A {@code metadata(name, value)} table
 * holds {@code format_version} and {@code serialization_format}.</p>
 *
 * <p>Not thread-safe: a store instance must be used from one thread.</p>
 */
public class SqliteAttributeContainerStore implements AttributeContainerStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SqliteAttributeContainerStore.class);

    public static final String SERIALIZATION_FORMAT_JSON = "json";

    private static final String METADATA_TABLE = "metadata";
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final FormatVersions formatVersions;
    private final Map<String, ContainerType<?>> containerTypes = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private Connection connection;
    private Path path;
    private boolean readOnly;
    private int formatVersion;
    private String serializationFormat;

    public SqliteAttributeContainerStore(FormatVersions formatVersions) {
        this.formatVersions = formatVersions;
    }

    /**
     * Registers container types so they can be stored and queried.
     */
    public void registerContainerTypes(List<ContainerType<?>> types) {
        for (ContainerType<?> type : types) {
            containerTypes.put(type.getName(), type);
        }
    }

    public boolean isOpen() {
        return connection != null;
    }

    public Path getPath() {
        return path;
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    public String getSerializationFormat() {
        return serializationFormat;
    }

    /**
     * Opens the store. A store opened for writing is created when the file does not exist.
     *
     * @param path     the database file
     * @param readOnly whether only queries are permitted
     * @throws IOException if the file cannot be opened or its metadata is not supported
     */
    public void open(Path path, boolean readOnly) throws IOException {
        if (connection != null) {
            throw new IllegalStateException("Cannot open store already opened.");
        }
        boolean exists = Files.isRegularFile(path);
        if (readOnly && !exists) {
            throw new IOException("No such store: " + path);
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(readOnly);
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + path, config.toProperties());
        } catch (SQLException e) {
            throw new IOException("Unable to open store: " + path, e);
        }
        this.path = path;
        this.readOnly = readOnly;

        try {
            if (!readOnly && !hasTable(METADATA_TABLE)) {
                writeMetadata();
            } else {
                readAndCheckStorageMetadata(readMetadata(), readOnly);
            }
        } catch (IOException | RuntimeException e) {
            closeQuietly();
            throw e;
        }
        log.debug("Opened attribute container store: {} (read-only: {})", path, readOnly);
    }

    /**
     * Checks the stored metadata against the format version floors.
     * Subclasses extend this to validate additional metadata values.
     *
     * @param metadata          the metadata values
     * @param checkReadableOnly whether the store only needs to be readable
     * @throws StorageFormatException if the metadata is not supported
     */
    protected void readAndCheckStorageMetadata(Map<String, String> metadata, boolean checkReadableOnly)
            throws StorageFormatException {
        String value = metadata.get("format_version");
        if (value == null || value.isBlank()) {
            throw new StorageFormatException("Missing format version.");
        }
        int version;
        try {
            version = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new StorageFormatException("Invalid format version: " + value + ".", e);
        }

        if (checkReadableOnly && version < formatVersions.readCompatibleVersion()) {
            throw new StorageFormatException(
                    "Format version: " + version + " is too old and can no longer be read.");
        }
        if (version > formatVersions.formatVersion()) {
            throw new StorageFormatException(
                    "Format version: " + version + " is too new and not supported.");
        }
        if (!checkReadableOnly && version < formatVersions.appendCompatibleVersion()) {
            if (version < formatVersions.upgradeCompatibleVersion()) {
                throw new StorageFormatException(
                        "Format version: " + version + " is too old and can no longer be written.");
            }
            throw new StorageFormatException(
                    "Format version: " + version + " must be upgraded before it can be written.");
        }

        String serialization = metadata.get("serialization_format");
        if (!SERIALIZATION_FORMAT_JSON.equals(serialization)) {
            throw new StorageFormatException("Unsupported serialization format: " + serialization);
        }

        this.formatVersion = version;
        this.serializationFormat = serialization;
    }

    /**
     * Metadata values written when a new store is created, besides the format values.
     */
    protected Map<String, String> getAdditionalMetadata() {
        return Map.of();
    }

    private Map<String, String> readMetadata() throws StorageFormatException {
        if (!hasTable(METADATA_TABLE)) {
            throw new StorageFormatException("Missing metadata table.");
        }
        Map<String, String> metadata = new HashMap<>();
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT name, value FROM " + METADATA_TABLE)) {
            while (resultSet.next()) {
                metadata.put(resultSet.getString(1), resultSet.getString(2));
            }
        } catch (SQLException e) {
            throw new StorageFormatException("Unable to read metadata", e);
        }
        return metadata;
    }

    private void writeMetadata() throws IOException {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("format_version", Integer.toString(formatVersions.formatVersion()));
        metadata.put("serialization_format", SERIALIZATION_FORMAT_JSON);
        metadata.putAll(getAdditionalMetadata());

        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE " + METADATA_TABLE + " (name TEXT, value TEXT)");
        } catch (SQLException e) {
            throw new IOException("Unable to create metadata table", e);
        }
        try (PreparedStatement insert = connection.prepareStatement(
                "INSERT INTO " + METADATA_TABLE + " (name, value) VALUES (?, ?)")) {
            for (Map.Entry<String, String> entry : metadata.entrySet()) {
                insert.setString(1, entry.getKey());
                insert.setString(2, entry.getValue());
                insert.executeUpdate();
            }
        } catch (SQLException e) {
            throw new IOException("Unable to write metadata", e);
        }
        readAndCheckStorageMetadata(metadata, false);
    }

    @Override
    public boolean hasAttributeContainers(ContainerType<?> type) {
        ensureOpen();
        if (!hasTable(type.getName())) {
            return false;
        }
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(
                     "SELECT COUNT(*) FROM " + type.getName())) {
            return resultSet.next() && resultSet.getLong(1) > 0;
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to count containers of type: " + type.getName(), e);
        }
    }

    @Override
    public <T extends AttributeContainer> List<T> getAttributeContainers(
            ContainerType<T> type, ContainerFilter filter) {
        ensureOpen();
        checkRegistered(type);
        if (!hasTable(type.getName())) {
            return List.of();
        }

        List<String> columns = new ArrayList<>(type.getSchema().keySet());
        StringBuilder sql = new StringBuilder("SELECT _identifier, ")
                .append(String.join(", ", columns))
                .append(" FROM ").append(type.getName());
        if (!filter.isEmpty()) {
            for (ContainerFilter.Condition condition : filter.getConditions()) {
                if (!type.getSchema().containsKey(condition.attributeName())) {
                    throw new IllegalArgumentException("Unknown attribute: " + condition.attributeName()
                            + " of container type: " + type.getName());
                }
            }
            sql.append(" WHERE ").append(filter.getConditions().stream()
                    .map(condition -> condition.attributeName() + " = ?")
                    .collect(Collectors.joining(" AND ")));
        }
        sql.append(" ORDER BY _identifier");
        log.debug("Querying {} where {}", type.getName(), filter);

        List<T> containers = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
            int index = 1;
            for (ContainerFilter.Condition condition : filter.getConditions()) {
                statement.setObject(index++, condition.sqlValue());
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    containers.add(readContainer(type, columns, resultSet));
                }
            }
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to query containers of type: " + type.getName(), e);
        }
        return containers;
    }

    @Override
    public <T extends AttributeContainer> Optional<T> getAttributeContainerByIdentifier(
            ContainerType<T> type, ContainerIdentifier identifier) {
        ensureOpen();
        checkRegistered(type);
        if (!type.getName().equals(identifier.name()) || !hasTable(type.getName())) {
            return Optional.empty();
        }
        List<String> columns = new ArrayList<>(type.getSchema().keySet());
        String sql = "SELECT _identifier, " + String.join(", ", columns)
                + " FROM " + type.getName() + " WHERE _identifier = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, identifier.sequenceNumber());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (resultSet.next()) {
                    return Optional.of(readContainer(type, columns, resultSet));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to read container: " + identifier, e);
        }
    }

    /**
     * Adds a container, creating the type table on first use.
     *
     * @return the assigned identifier
     */
    public <T extends AttributeContainer> ContainerIdentifier addAttributeContainer(
            ContainerType<T> type, T container) {
        ensureOpen();
        checkRegistered(type);
        if (readOnly) {
            throw new IllegalStateException("Cannot add container to store opened read-only.");
        }
        createTableIfMissing(type);

        Map<String, Object> attributes = type.toAttributes(container);
        List<String> columns = new ArrayList<>(attributes.keySet());
        String sql = "INSERT INTO " + type.getName() + " (" + String.join(", ", columns) + ") VALUES ("
                + columns.stream().map(column -> "?").collect(Collectors.joining(", ")) + ")";

        try (PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            int index = 1;
            for (String column : columns) {
                bindAttribute(statement, index++, type.getSchema().get(column), attributes.get(column));
            }
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new ResourceDatabaseException("No identifier generated for: " + type.getName());
                }
                ContainerIdentifier identifier = new ContainerIdentifier(type.getName(), keys.getLong(1));
                container.setIdentifier(identifier);
                return identifier;
            }
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to add container of type: " + type.getName(), e);
        }
    }

    private void createTableIfMissing(ContainerType<?> type) {
        if (hasTable(type.getName())) {
            return;
        }
        String columns = type.getSchema().entrySet().stream()
                .map(entry -> entry.getKey() + (entry.getValue() == AttributeType.INTEGER ? " INTEGER" : " TEXT"))
                .collect(Collectors.joining(", "));
        String sql = "CREATE TABLE " + type.getName()
                + " (_identifier INTEGER PRIMARY KEY AUTOINCREMENT, " + columns + ")";
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to create table for: " + type.getName(), e);
        }
    }

    private void bindAttribute(PreparedStatement statement, int index, AttributeType type, Object value)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, type == AttributeType.INTEGER ? Types.INTEGER : Types.VARCHAR);
            return;
        }
        switch (type) {
            case INTEGER -> statement.setLong(index, (Long) value);
            case STRING_LIST -> {
                try {
                    statement.setString(index, objectMapper.writeValueAsString(value));
                } catch (JsonProcessingException e) {
                    throw new ResourceDatabaseException("Unable to serialize list attribute", e);
                }
            }
            default -> statement.setString(index, value.toString());
        }
    }

    private <T extends AttributeContainer> T readContainer(
            ContainerType<T> type, List<String> columns, ResultSet resultSet) throws SQLException {
        Map<String, Object> attributes = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            Object value = resultSet.getObject(i + 2);
            if (value != null && type.getSchema().get(column) == AttributeType.STRING_LIST) {
                try {
                    value = objectMapper.readValue(value.toString(), STRING_LIST);
                } catch (JsonProcessingException e) {
                    throw new ResourceDatabaseException("Unable to deserialize attribute: " + column, e);
                }
            }
            attributes.put(column, value);
        }
        T container = type.fromAttributes(attributes);
        container.setIdentifier(new ContainerIdentifier(type.getName(), resultSet.getLong(1)));
        return container;
    }

    private boolean hasTable(String tableName) {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            statement.setString(1, tableName);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to determine if table exists: " + tableName, e);
        }
    }

    private void checkRegistered(ContainerType<?> type) {
        if (!containerTypes.containsKey(type.getName())) {
            throw new IllegalArgumentException("Unsupported container type: " + type.getName());
        }
    }

    private void ensureOpen() {
        if (connection == null) {
            throw new IllegalStateException("Store not opened.");
        }
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing store: {}", path, e);
        }
        connection = null;
        path = null;
    }

    @Override
    public void close() {
        if (connection == null) {
            throw new IllegalStateException("Cannot close store not opened.");
        }
        try {
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
            connection.close();
        } catch (SQLException e) {
            throw new ResourceDatabaseException("Unable to close store: " + path, e);
        } finally {
            connection = null;
            path = null;
        }
    }
}
