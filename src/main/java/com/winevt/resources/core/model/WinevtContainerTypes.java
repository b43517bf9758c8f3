package com.winevt.resources.core.model;

import com.winevt.resources.store.AttributeType;
import com.winevt.resources.store.ContainerIdentifier;
import com.winevt.resources.store.ContainerType;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Container types of the Windows EventLog resource model.
 *
 * <p>Two families exist: the {@code windows_*} types recorded in a forensic case storage
 * by the artifact parsers, and the {@code winevtrc_*} types of the versioned resource
 * store. Both families map onto the same model classes.</p>
 */
public final class WinevtContainerTypes {

    // Case storage

    public static final ContainerType<EventLogProvider> EVENTLOG_PROVIDER =
            providerType("windows_eventlog_provider");

    public static final ContainerType<MessageFile> EVENTLOG_MESSAGE_FILE =
            ContainerType.<MessageFile>builder("windows_eventlog_message_file")
                    .attribute("path", AttributeType.STRING)
                    .attribute("windows_path", AttributeType.STRING)
                    .attribute("file_version", AttributeType.STRING)
                    .attribute("product_version", AttributeType.STRING)
                    .reader(values -> new MessageFile(
                            (String) values.get("path"), null,
                            (String) values.get("file_version"),
                            (String) values.get("product_version")))
                    .writer(file -> attributes(
                            "path", file.getWindowsPath(),
                            "windows_path", file.getWindowsPath(),
                            "file_version", file.getFileVersion(),
                            "product_version", file.getProductVersion()))
                    .build();

    public static final ContainerType<MessageString> EVENTLOG_MESSAGE_STRING =
            ContainerType.<MessageString>builder("windows_eventlog_message_string")
                    .attribute("_message_file_identifier", AttributeType.IDENTIFIER)
                    .attribute("language_identifier", AttributeType.INTEGER)
                    .attribute("message_identifier", AttributeType.INTEGER)
                    .attribute("string", AttributeType.STRING)
                    .reader(values -> MessageString.builder()
                            .messageFileIdentifier((ContainerIdentifier) values.get("_message_file_identifier"))
                            .languageIdentifier(intValue(values.get("language_identifier")))
                            .messageIdentifier(longValue(values.get("message_identifier")))
                            .text((String) values.get("string"))
                            .build())
                    .writer(string -> attributes(
                            "_message_file_identifier", string.getMessageFileIdentifier(),
                            "language_identifier", string.getLanguageIdentifier(),
                            "message_identifier", string.getMessageIdentifier(),
                            "string", string.getText()))
                    .build();

    public static final ContainerType<MessageStringMapping> WEVT_TEMPLATE_EVENT =
            mappingType("windows_wevt_template_event", "identifier", "version");

    public static final ContainerType<EnvironmentVariable> ENVIRONMENT_VARIABLE =
            ContainerType.<EnvironmentVariable>builder("environment_variable")
                    .attribute("name", AttributeType.STRING)
                    .attribute("value", AttributeType.STRING)
                    .reader(values -> new EnvironmentVariable(
                            (String) values.get("name"), (String) values.get("value")))
                    .writer(variable -> attributes(
                            "name", variable.getName(),
                            "value", variable.getValue()))
                    .build();

    // Versioned resource store

    public static final ContainerType<EventLogProvider> WINEVTRC_EVENTLOG_PROVIDER =
            providerType("winevtrc_eventlog_provider");

    public static final ContainerType<MessageFile> WINEVTRC_MESSAGE_FILE =
            ContainerType.<MessageFile>builder("winevtrc_message_file")
                    .attribute("file_version", AttributeType.STRING)
                    .attribute("product_version", AttributeType.STRING)
                    .attribute("windows_path", AttributeType.STRING)
                    .attribute("windows_version", AttributeType.STRING)
                    .reader(values -> new MessageFile(
                            (String) values.get("windows_path"),
                            (String) values.get("windows_version"),
                            (String) values.get("file_version"),
                            (String) values.get("product_version")))
                    .writer(file -> attributes(
                            "file_version", file.getFileVersion(),
                            "product_version", file.getProductVersion(),
                            "windows_path", file.getWindowsPath(),
                            "windows_version", file.getWindowsVersion()))
                    .build();

    public static final ContainerType<MessageString> WINEVTRC_MESSAGE_STRING =
            ContainerType.<MessageString>builder("winevtrc_message_string")
                    .attribute("_message_table_identifier", AttributeType.IDENTIFIER)
                    .attribute("language_identifier", AttributeType.INTEGER)
                    .attribute("message_identifier", AttributeType.INTEGER)
                    .attribute("text", AttributeType.STRING)
                    .reader(values -> MessageString.builder()
                            .messageTableIdentifier((ContainerIdentifier) values.get("_message_table_identifier"))
                            .languageIdentifier(intValue(values.get("language_identifier")))
                            .messageIdentifier(longValue(values.get("message_identifier")))
                            .text((String) values.get("text"))
                            .build())
                    .writer(string -> attributes(
                            "_message_table_identifier", string.getMessageTableIdentifier(),
                            "language_identifier", string.getLanguageIdentifier(),
                            "message_identifier", string.getMessageIdentifier(),
                            "text", string.getText()))
                    .build();

    public static final ContainerType<MessageStringMapping> WINEVTRC_MESSAGE_STRING_MAPPING =
            mappingType("winevtrc_message_string_mapping", "event_identifier", "event_version");

    public static final ContainerType<MessageTable> WINEVTRC_MESSAGE_TABLE =
            ContainerType.<MessageTable>builder("winevtrc_message_table")
                    .attribute("_message_file_identifier", AttributeType.IDENTIFIER)
                    .attribute("language_identifier", AttributeType.INTEGER)
                    .reader(values -> new MessageTable(
                            (ContainerIdentifier) values.get("_message_file_identifier"),
                            intValue(values.get("language_identifier"))))
                    .writer(table -> attributes(
                            "_message_file_identifier", table.getMessageFileIdentifier(),
                            "language_identifier", table.getLanguageIdentifier()))
                    .build();

    /**
     * Container types registered with the versioned resource store.
     */
    public static final List<ContainerType<?>> WINEVTRC_TYPES = List.of(
            WINEVTRC_EVENTLOG_PROVIDER, WINEVTRC_MESSAGE_FILE, WINEVTRC_MESSAGE_STRING,
            WINEVTRC_MESSAGE_STRING_MAPPING, WINEVTRC_MESSAGE_TABLE);

    private WinevtContainerTypes() {
        // constants
    }

    @SuppressWarnings("unchecked")
    private static ContainerType<EventLogProvider> providerType(String name) {
        return ContainerType.<EventLogProvider>builder(name)
                .attribute("additional_identifier", AttributeType.STRING)
                .attribute("category_message_files", AttributeType.STRING_LIST)
                .attribute("event_message_files", AttributeType.STRING_LIST)
                .attribute("identifier", AttributeType.STRING)
                .attribute("log_sources", AttributeType.STRING_LIST)
                .attribute("log_types", AttributeType.STRING_LIST)
                .attribute("name", AttributeType.STRING)
                .attribute("parameter_message_files", AttributeType.STRING_LIST)
                .attribute("windows_version", AttributeType.STRING)
                .reader(values -> EventLogProvider.builder()
                        .additionalIdentifier((String) values.get("additional_identifier"))
                        .categoryMessageFiles((List<String>) values.get("category_message_files"))
                        .eventMessageFiles((List<String>) values.get("event_message_files"))
                        .identifier((String) values.get("identifier"))
                        .logSources((List<String>) values.get("log_sources"))
                        .logTypes((List<String>) values.get("log_types"))
                        .name((String) values.get("name"))
                        .parameterMessageFiles((List<String>) values.get("parameter_message_files"))
                        .windowsVersion((String) values.get("windows_version"))
                        .build())
                .writer(provider -> attributes(
                        "additional_identifier", provider.getAdditionalIdentifier(),
                        "category_message_files", List.copyOf(provider.getCategoryMessageFiles()),
                        "event_message_files", List.copyOf(provider.getEventMessageFiles()),
                        "identifier", provider.getProviderIdentifier(),
                        "log_sources", provider.getLogSources(),
                        "log_types", provider.getLogTypes(),
                        "name", provider.getName(),
                        "parameter_message_files", List.copyOf(provider.getParameterMessageFiles()),
                        "windows_version", provider.getWindowsVersion()))
                .build();
    }

    private static ContainerType<MessageStringMapping> mappingType(
            String name, String eventIdentifierAttribute, String eventVersionAttribute) {
        return ContainerType.<MessageStringMapping>builder(name)
                .attribute("_message_file_identifier", AttributeType.IDENTIFIER)
                .attribute(eventIdentifierAttribute, AttributeType.INTEGER)
                .attribute(eventVersionAttribute, AttributeType.INTEGER)
                .attribute("message_identifier", AttributeType.INTEGER)
                .attribute("provider_identifier", AttributeType.STRING)
                .reader(values -> new MessageStringMapping(
                        (ContainerIdentifier) values.get("_message_file_identifier"),
                        (String) values.get("provider_identifier"),
                        longValue(values.get(eventIdentifierAttribute)),
                        values.get(eventVersionAttribute) != null
                                ? intValue(values.get(eventVersionAttribute)) : null,
                        longValue(values.get("message_identifier"))))
                .writer(mapping -> attributes(
                        "_message_file_identifier", mapping.getMessageFileIdentifier(),
                        eventIdentifierAttribute, mapping.getEventIdentifier(),
                        eventVersionAttribute, mapping.getEventVersion(),
                        "message_identifier", mapping.getMessageIdentifier(),
                        "provider_identifier", mapping.getProviderIdentifier()))
                .build();
    }

    private static Map<String, Object> attributes(Object... namesAndValues) {
        Map<String, Object> attributes = new HashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            attributes.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return attributes;
    }

    private static long longValue(Object value) {
        return value != null ? ((Number) value).longValue() : 0L;
    }

    private static int intValue(Object value) {
        return value != null ? ((Number) value).intValue() : 0;
    }
}
