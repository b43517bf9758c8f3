package com.winevt.resources.core.model;

import com.winevt.resources.store.AbstractAttributeContainer;
import com.winevt.resources.store.ContainerIdentifier;

/**
 * Message table of one language within a message file.
 */
public class MessageTable extends AbstractAttributeContainer {

    private final ContainerIdentifier messageFileIdentifier;
    private final int languageIdentifier;

    public MessageTable(ContainerIdentifier messageFileIdentifier, int languageIdentifier) {
        this.messageFileIdentifier = messageFileIdentifier;
        this.languageIdentifier = languageIdentifier;
    }

    /**
     * Identifier of the message file this table belongs to.
     */
    public ContainerIdentifier getMessageFileIdentifier() {
        return messageFileIdentifier;
    }

    /**
     * Language code identifier (LCID) of the table.
     */
    public int getLanguageIdentifier() {
        return languageIdentifier;
    }

    @Override
    public String toString() {
        return "MessageTable{" +
                "identifier=" + getIdentifier() +
                ", messageFileIdentifier=" + messageFileIdentifier +
                ", languageIdentifier=0x" + String.format("%04x", languageIdentifier) +
                '}';
    }
}
