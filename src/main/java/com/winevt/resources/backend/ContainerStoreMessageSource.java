package com.winevt.resources.backend;

import com.winevt.resources.core.model.MessageString;
import com.winevt.resources.core.model.MessageTable;
import com.winevt.resources.core.model.StringFormat;
import com.winevt.resources.core.model.WinevtContainerTypes;
import com.winevt.resources.store.ContainerFilter;
import com.winevt.resources.store.ContainerIdentifier;
import com.winevt.resources.store.WinevtResourcesContainerStore;
import com.winevt.resources.windows.MessageStringFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves message strings from a versioned resource store used as fallback database.
 *
 * <p>Message strings are reached through the message tables of the resolved message files.
 * Strings in the wrc format are converted to positional format. The store is closed with
 * the source.</p>
 */
public class ContainerStoreMessageSource extends AbstractContainerMessageSource {
    private static final Logger log = LoggerFactory.getLogger(ContainerStoreMessageSource.class);

    public static final String NAME = "resource-store";

    private final WinevtResourcesContainerStore containerStore;

    public ContainerStoreMessageSource(WinevtResourcesContainerStore containerStore, int lcid, String languageTag) {
        super(containerStore, ContainerTypeSet.RESOURCE_STORE, lcid, languageTag);
        this.containerStore = containerStore;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected boolean hasMessageStrings() {
        return store.hasAttributeContainers(WinevtContainerTypes.WINEVTRC_MESSAGE_STRING);
    }

    @Override
    protected Optional<String> findMessageString(Set<ContainerIdentifier> messageFileIdentifiers,
                                                 long messageIdentifier) {
        for (ContainerIdentifier messageFileIdentifier : messageFileIdentifiers) {
            ContainerFilter tableFilter = ContainerFilter.where("_message_file_identifier", messageFileIdentifier)
                    .and("language_identifier", lcid);

            for (MessageTable messageTable : store.getAttributeContainers(
                    WinevtContainerTypes.WINEVTRC_MESSAGE_TABLE, tableFilter)) {
                ContainerFilter stringFilter = ContainerFilter
                        .where("_message_table_identifier", messageTable.getIdentifier())
                        .and("message_identifier", messageIdentifier);

                List<MessageString> messageStrings = store.getAttributeContainers(
                        WinevtContainerTypes.WINEVTRC_MESSAGE_STRING, stringFilter);
                if (!messageStrings.isEmpty()) {
                    return Optional.ofNullable(format(messageStrings.get(0).getText()));
                }
            }
        }
        return Optional.empty();
    }

    private String format(String text) {
        if (containerStore.getStringFormat() == StringFormat.WRC) {
            return MessageStringFormatter.formatInPositionalFormat(text);
        }
        return text;
    }

    @Override
    public void close() {
        if (containerStore.isOpen()) {
            Path path = containerStore.getPath();
            containerStore.close();
            log.info("Closed EventLog resources store: {}", path);
        }
    }
}
