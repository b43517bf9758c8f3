package com.winevt.resources.backend;

import com.winevt.resources.core.model.EnvironmentVariable;
import com.winevt.resources.core.model.EventLogProvider;
import com.winevt.resources.core.model.MessageFile;
import com.winevt.resources.core.model.MessageStringMapping;
import com.winevt.resources.core.model.WinevtContainerTypes;
import com.winevt.resources.store.ContainerType;

/**
 * The container types a container-backed source reads.
 *
 * @param providerType                      EventLog provider type
 * @param messageFileType                   message file type
 * @param environmentVariableType           environment variable type, or null when the store has none
 * @param mappingType                       WEVT_TEMPLATE mapping type
 * @param mappingEventIdentifierAttribute   event identifier attribute of the mapping type
 * @param mappingEventVersionAttribute      event version attribute of the mapping type
 */
public record ContainerTypeSet(
        ContainerType<EventLogProvider> providerType,
        ContainerType<MessageFile> messageFileType,
        ContainerType<EnvironmentVariable> environmentVariableType,
        ContainerType<MessageStringMapping> mappingType,
        String mappingEventIdentifierAttribute,
        String mappingEventVersionAttribute) {

    /**
     * Types recorded in a forensic case storage by the artifact parsers.
     */
    public static final ContainerTypeSet CASE_STORAGE = new ContainerTypeSet(
            WinevtContainerTypes.EVENTLOG_PROVIDER,
            WinevtContainerTypes.EVENTLOG_MESSAGE_FILE,
            WinevtContainerTypes.ENVIRONMENT_VARIABLE,
            WinevtContainerTypes.WEVT_TEMPLATE_EVENT,
            "identifier",
            "version");

    /**
     * Types of the versioned resource store.
     */
    public static final ContainerTypeSet RESOURCE_STORE = new ContainerTypeSet(
            WinevtContainerTypes.WINEVTRC_EVENTLOG_PROVIDER,
            WinevtContainerTypes.WINEVTRC_MESSAGE_FILE,
            null,
            WinevtContainerTypes.WINEVTRC_MESSAGE_STRING_MAPPING,
            "event_identifier",
            "event_version");
}
