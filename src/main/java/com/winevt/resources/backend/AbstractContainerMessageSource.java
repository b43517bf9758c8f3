package com.winevt.resources.backend;

import com.winevt.resources.core.model.EventLogProvider;
import com.winevt.resources.core.model.MessageStringMapping;
import com.winevt.resources.store.AttributeContainerStore;
import com.winevt.resources.store.ContainerFilter;
import com.winevt.resources.store.ContainerIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base class for sources that resolve message strings by traversing attribute containers:
 * provider, WEVT_TEMPLATE mapping, message files and finally message strings.
 *
 * <p>Subclasses supply how message strings are looked up for a set of message files.</p>
 */
public abstract class AbstractContainerMessageSource implements MessageStringSource {
    private static final Logger log = LoggerFactory.getLogger(AbstractContainerMessageSource.class);

    /**
     * Message files consulted for parameter strings when a provider defines none.
     */
    public static final List<String> DEFAULT_PARAMETER_MESSAGE_FILES = List.of(
            "%SystemRoot%\\System32\\MsObjs.dll",
            "%SystemRoot%\\System32\\kernel32.dll");

    protected final AttributeContainerStore store;
    protected final ContainerTypeSet types;
    protected final int lcid;
    protected final ResourceIndex index;

    protected AbstractContainerMessageSource(AttributeContainerStore store, ContainerTypeSet types,
                                             int lcid, String languageTag) {
        this.store = store;
        this.types = types;
        this.lcid = lcid;
        this.index = new ResourceIndex(store, types, languageTag);
    }

    /**
     * Determines whether the store holds any message strings at all.
     */
    protected abstract boolean hasMessageStrings();

    /**
     * Retrieves the text of the first message string with the identifier in one of the
     * message files, in the active language.
     *
     * @param messageFileIdentifiers identifiers of the candidate message files
     * @param messageIdentifier      message identifier
     * @return the message text, or empty if none matched
     */
    protected abstract Optional<String> findMessageString(Set<ContainerIdentifier> messageFileIdentifiers,
                                                          long messageIdentifier);

    @Override
    public Optional<String> getMessageString(String providerIdentifier, String logSource, long messageIdentifier,
                                             Integer eventVersion) {
        ResourceIndex.ProviderLookup lookup = index.findProvider(providerIdentifier, logSource);
        if (!lookup.isFound() || !hasMessageStrings()) {
            return Optional.empty();
        }

        long mappedIdentifier = getMappedMessageIdentifier(providerIdentifier, messageIdentifier, eventVersion);

        Set<ContainerIdentifier> messageFileIdentifiers =
                index.getMessageFileIdentifiers(lookup.provider().getEventMessageFiles());
        if (messageFileIdentifiers.isEmpty()) {
            log.warn(String.format("No event message file for identifier: 0x%08x (original: 0x%08x) of provider: %s",
                    mappedIdentifier, messageIdentifier, lookup.lookupKey()));
            return Optional.empty();
        }

        Optional<String> messageString = findMessageString(messageFileIdentifiers, mappedIdentifier);
        if (messageString.isEmpty()) {
            log.warn(String.format("No message string for identifier: 0x%08x (original: 0x%08x) of provider: %s",
                    mappedIdentifier, messageIdentifier, lookup.lookupKey()));
        }
        return messageString;
    }

    @Override
    public Optional<String> getParameterString(String providerIdentifier, String logSource, long messageIdentifier) {
        ResourceIndex.ProviderLookup lookup = index.findProvider(providerIdentifier, logSource);
        if (!lookup.isFound() || !hasMessageStrings()) {
            return Optional.empty();
        }

        Set<ContainerIdentifier> messageFileIdentifiers =
                index.getMessageFileIdentifiers(getParameterMessageFiles(lookup.provider()));
        if (messageFileIdentifiers.isEmpty()) {
            log.warn(String.format("No parameter message file for identifier: 0x%08x of provider: %s",
                    messageIdentifier, lookup.lookupKey()));
            return Optional.empty();
        }

        Optional<String> parameterString = findMessageString(messageFileIdentifiers, messageIdentifier);
        if (parameterString.isEmpty()) {
            log.warn(String.format("No parameter string for identifier: 0x%08x of provider: %s",
                    messageIdentifier, lookup.lookupKey()));
        }
        return parameterString;
    }

    /**
     * Returns the parameter message files of a provider, or its event message files followed
     * by the default parameter message files when it defines none.
     */
    static Collection<String> getParameterMessageFiles(EventLogProvider provider) {
        if (!provider.getParameterMessageFiles().isEmpty()) {
            return provider.getParameterMessageFiles();
        }
        List<String> messageFiles = new ArrayList<>(provider.getEventMessageFiles());
        messageFiles.addAll(DEFAULT_PARAMETER_MESSAGE_FILES);
        return messageFiles;
    }

    /**
     * Maps an event identifier to the message identifier defined by a WEVT_TEMPLATE event
     * definition, if one matches.
     */
    long getMappedMessageIdentifier(String providerIdentifier, long messageIdentifier, Integer eventVersion) {
        if (providerIdentifier == null || providerIdentifier.isEmpty()
                || !store.hasAttributeContainers(types.mappingType())) {
            return messageIdentifier;
        }

        ContainerFilter filter = ContainerFilter.where("provider_identifier", providerIdentifier)
                .and(types.mappingEventIdentifierAttribute(), messageIdentifier);
        if (eventVersion != null) {
            filter = filter.and(types.mappingEventVersionAttribute(), eventVersion);
        }

        List<MessageStringMapping> mappings = store.getAttributeContainers(types.mappingType(), filter);
        if (mappings.isEmpty()) {
            return messageIdentifier;
        }
        long mappedIdentifier = mappings.get(0).getMessageIdentifier();
        if (log.isDebugEnabled()) {
            log.debug(String.format("Message: 0x%08x of provider: %s maps to: 0x%08x",
                    messageIdentifier, providerIdentifier, mappedIdentifier));
        }
        return mappedIdentifier;
    }

    @Override
    public String toString() {
        return getName();
    }
}
