package com.winevt.resources.backend;

import com.winevt.resources.core.model.MessageString;
import com.winevt.resources.core.model.WinevtContainerTypes;
import com.winevt.resources.store.AttributeContainerStore;
import com.winevt.resources.store.ContainerFilter;
import com.winevt.resources.store.ContainerIdentifier;

import java.util.Optional;
import java.util.Set;

/**
 * Resolves message strings from the EventLog resources recorded in a case storage.
 * The storage is owned by the caller and is not closed by this source.
 */
public class StorageReaderMessageSource extends AbstractContainerMessageSource {

    public static final String NAME = "storage";

    public StorageReaderMessageSource(AttributeContainerStore storageReader, int lcid, String languageTag) {
        super(storageReader, ContainerTypeSet.CASE_STORAGE, lcid, languageTag);
    }

    /**
     * Determines whether a storage reader holds EventLog providers and can serve as source.
     */
    public static boolean isSupported(AttributeContainerStore storageReader) {
        return storageReader != null
                && storageReader.hasAttributeContainers(WinevtContainerTypes.EVENTLOG_PROVIDER);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected boolean hasMessageStrings() {
        return store.hasAttributeContainers(WinevtContainerTypes.EVENTLOG_MESSAGE_STRING);
    }

    @Override
    protected Optional<String> findMessageString(Set<ContainerIdentifier> messageFileIdentifiers,
                                                 long messageIdentifier) {
        ContainerFilter filter = ContainerFilter.where("language_identifier", lcid)
                .and("message_identifier", messageIdentifier);

        for (MessageString messageString : store.getAttributeContainers(
                WinevtContainerTypes.EVENTLOG_MESSAGE_STRING, filter)) {
            if (messageFileIdentifiers.contains(messageString.getMessageFileIdentifier())) {
                return Optional.ofNullable(messageString.getText());
            }
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        // storage reader is owned by the caller
    }
}
