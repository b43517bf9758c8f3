package com.winevt.resources.core.model;

import com.winevt.resources.store.AbstractAttributeContainer;
import com.winevt.resources.store.ContainerIdentifier;

/**
 * WEVT_TEMPLATE event definition: maps an event identifier, optionally qualified by
 * event version, of a provider to the message identifier used to render it.
 */
public class MessageStringMapping extends AbstractAttributeContainer {

    private final ContainerIdentifier messageFileIdentifier;
    private final String providerIdentifier;
    private final long eventIdentifier;
    private final Integer eventVersion;
    private final long messageIdentifier;

    public MessageStringMapping(ContainerIdentifier messageFileIdentifier, String providerIdentifier,
                                long eventIdentifier, Integer eventVersion, long messageIdentifier) {
        this.messageFileIdentifier = messageFileIdentifier;
        this.providerIdentifier = providerIdentifier;
        this.eventIdentifier = eventIdentifier;
        this.eventVersion = eventVersion;
        this.messageIdentifier = messageIdentifier;
    }

    public ContainerIdentifier getMessageFileIdentifier() {
        return messageFileIdentifier;
    }

    public String getProviderIdentifier() {
        return providerIdentifier;
    }

    public long getEventIdentifier() {
        return eventIdentifier;
    }

    /**
     * Event version, or null when the definition is not versioned.
     */
    public Integer getEventVersion() {
        return eventVersion;
    }

    public long getMessageIdentifier() {
        return messageIdentifier;
    }

    @Override
    public String toString() {
        return "MessageStringMapping{" +
                "providerIdentifier='" + providerIdentifier + '\'' +
                ", eventIdentifier=" + eventIdentifier +
                ", eventVersion=" + eventVersion +
                ", messageIdentifier=0x" + String.format("%08x", messageIdentifier) +
                '}';
    }
}
