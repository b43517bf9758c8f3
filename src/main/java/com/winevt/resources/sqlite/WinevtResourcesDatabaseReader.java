package com.winevt.resources.sqlite;

import com.winevt.resources.core.model.StringFormat;
import com.winevt.resources.windows.MessageStringFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reader of the legacy, flat Windows EventLog resources SQLite database.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code metadata(name, value)} with {@code version} and optional {@code string_format}</li>
 *   <li>{@code event_log_providers(log_source, event_log_provider_key)}</li>
 *   <li>{@code message_file_per_event_log_provider(event_log_provider_key, message_file_key)}</li>
 *   <li>{@code message_table_<file key>_0x<lcid as 8 hex digits>(message_identifier, message_string)},
 *       with the message identifier stored as {@code 0x} and 8 hex digits</li>
 * </ul>
 */
public class WinevtResourcesDatabaseReader implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WinevtResourcesDatabaseReader.class);

    public static final String SUPPORTED_VERSION = "20150315";

    private final ResourceDatabaseFile databaseFile;
    private StringFormat stringFormat = StringFormat.WRC;

    public WinevtResourcesDatabaseReader() {
        this(new SqliteDatabaseFile());
    }

    public WinevtResourcesDatabaseReader(ResourceDatabaseFile databaseFile) {
        this.databaseFile = databaseFile;
    }

    /**
     * Opens the database read-only and validates its metadata.
     *
     * @param path the database file
     * @return true if successful, false if the file could not be opened
     * @throws UnsupportedDatabaseFormatException if the version or string format is not supported
     */
    public boolean open(Path path) {
        if (!databaseFile.open(path, true)) {
            return false;
        }

        try {
            String version = getMetadataAttribute("version").orElse(null);
            if (!SUPPORTED_VERSION.equals(version)) {
                throw new UnsupportedDatabaseFormatException("version", version);
            }

            String value = getMetadataAttribute("string_format").orElse(StringFormat.WRC.getValue());
            StringFormat format = StringFormat.fromValue(value);
            if (format == null) {
                throw new UnsupportedDatabaseFormatException("string_format", value);
            }
            this.stringFormat = format;
        } catch (RuntimeException e) {
            databaseFile.close();
            throw e;
        }

        log.debug("Opened EventLog resources database: {} (string format: {})", path, stringFormat.getValue());
        return true;
    }

    public StringFormat getStringFormat() {
        return stringFormat;
    }

    /**
     * Retrieves a message of an EventLog source.
     *
     * <p>Message files of the provider are searched in database order and the first
     * non-empty message wins. Messages in the wrc string format are converted to
     * positional format.</p>
     *
     * @param logSource         EventLog source, such as "Application Error"
     * @param lcid              language code identifier
     * @param messageIdentifier message identifier
     * @return the message string, or empty if not available
     * @throws DatabaseIntegrityException if the database holds duplicate rows
     */
    public Optional<String> getMessage(String logSource, int lcid, long messageIdentifier) {
        if (logSource == null) {
            return Optional.empty();
        }
        Long providerKey = getEventLogProviderKey(logSource);
        if (providerKey == null) {
            return Optional.empty();
        }

        String messageString = null;
        try (Stream<Long> messageFileKeys = getMessageFileKeys(providerKey)) {
            Iterator<Long> iterator = messageFileKeys.iterator();
            while (iterator.hasNext()) {
                messageString = getMessage(iterator.next(), lcid, messageIdentifier);
                if (messageString != null && !messageString.isEmpty()) {
                    break;
                }
            }
        }

        if (stringFormat == StringFormat.WRC) {
            messageString = MessageStringFormatter.formatInPositionalFormat(messageString);
        }
        return Optional.ofNullable(messageString).filter(value -> !value.isEmpty());
    }

    /**
     * Retrieves a metadata attribute.
     *
     * @param attributeName name of the attribute
     * @return the value, or empty if the metadata table or the attribute is absent
     * @throws DatabaseIntegrityException if the attribute is defined more than once
     */
    public Optional<String> getMetadataAttribute(String attributeName) {
        if (!databaseFile.hasTable("metadata")) {
            return Optional.empty();
        }
        List<Map<String, Object>> values = collect(
                List.of("metadata"), List.of("value"), "name = " + quote(attributeName));
        Object value = singleValue(values, "value", "metadata attribute: " + attributeName);
        return Optional.ofNullable(value).map(Object::toString);
    }

    private Long getEventLogProviderKey(String logSource) {
        List<Map<String, Object>> values = collect(
                List.of("event_log_providers"), List.of("event_log_provider_key"),
                "log_source = " + quote(logSource));
        if (values.isEmpty()) {
            values = collect(
                    List.of("event_log_providers"), List.of("event_log_provider_key"),
                    "log_source = " + quote(logSource) + " COLLATE NOCASE");
        }
        Object value = singleValue(values, "event_log_provider_key", "EventLog provider: " + logSource);
        return value != null ? ((Number) value).longValue() : null;
    }

    private Stream<Long> getMessageFileKeys(long providerKey) {
        return databaseFile.getValues(
                        List.of("message_file_per_event_log_provider"), List.of("message_file_key"),
                        "event_log_provider_key = " + providerKey)
                .map(row -> ((Number) row.get("message_file_key")).longValue());
    }

    private String getMessage(long messageFileKey, int lcid, long messageIdentifier) {
        String tableName = String.format("message_table_%d_0x%08x", messageFileKey, lcid);
        if (!databaseFile.hasTable(tableName)) {
            return null;
        }
        List<Map<String, Object>> values = collect(
                List.of(tableName), List.of("message_string"),
                "message_identifier = " + quote(String.format("0x%08x", messageIdentifier)));
        Object value = singleValue(values, "message_string", "message in table: " + tableName);
        return value != null ? value.toString() : null;
    }

    private List<Map<String, Object>> collect(List<String> tables, List<String> columns, String condition) {
        try (Stream<Map<String, Object>> rows = databaseFile.getValues(tables, columns, condition)) {
            return rows.collect(Collectors.toList());
        }
    }

    private static Object singleValue(List<Map<String, Object>> values, String column, String description) {
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new DatabaseIntegrityException("More than one value found in database for " + description);
        }
        return values.get(0).get(column);
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public void close() {
        databaseFile.close();
    }
}
