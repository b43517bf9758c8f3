package com.winevt.resources.core.model;

import com.winevt.resources.store.AbstractAttributeContainer;
import com.winevt.resources.store.ContainerIdentifier;

/**
 * A localized message text.
 *
 * <p>Resource stores link a message string to its {@link MessageTable}; case storage
 * links it directly to its {@link MessageFile}. Whichever link the source does not
 * record is null.</p>
 */
public class MessageString extends AbstractAttributeContainer {

    private final ContainerIdentifier messageTableIdentifier;
    private final ContainerIdentifier messageFileIdentifier;
    private final int languageIdentifier;
    private final long messageIdentifier;
    private final String text;

    private MessageString(Builder builder) {
        this.messageTableIdentifier = builder.messageTableIdentifier;
        this.messageFileIdentifier = builder.messageFileIdentifier;
        this.languageIdentifier = builder.languageIdentifier;
        this.messageIdentifier = builder.messageIdentifier;
        this.text = builder.text;
    }

    public ContainerIdentifier getMessageTableIdentifier() {
        return messageTableIdentifier;
    }

    public ContainerIdentifier getMessageFileIdentifier() {
        return messageFileIdentifier;
    }

    public int getLanguageIdentifier() {
        return languageIdentifier;
    }

    public long getMessageIdentifier() {
        return messageIdentifier;
    }

    public String getText() {
        return text;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MessageString{" +
                "identifier=" + getIdentifier() +
                ", messageIdentifier=0x" + String.format("%08x", messageIdentifier) +
                ", languageIdentifier=0x" + String.format("%04x", languageIdentifier) +
                ", text='" + text + '\'' +
                '}';
    }

    public static class Builder {
        private ContainerIdentifier messageTableIdentifier;
        private ContainerIdentifier messageFileIdentifier;
        private int languageIdentifier;
        private long messageIdentifier;
        private String text;

        public Builder messageTableIdentifier(ContainerIdentifier messageTableIdentifier) {
            this.messageTableIdentifier = messageTableIdentifier;
            return this;
        }

        public Builder messageFileIdentifier(ContainerIdentifier messageFileIdentifier) {
            this.messageFileIdentifier = messageFileIdentifier;
            return this;
        }

        public Builder languageIdentifier(int languageIdentifier) {
            this.languageIdentifier = languageIdentifier;
            return this;
        }

        public Builder messageIdentifier(long messageIdentifier) {
            this.messageIdentifier = messageIdentifier;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public MessageString build() {
            return new MessageString(this);
        }
    }
}
