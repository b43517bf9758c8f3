package com.winevt.resources.store;

import java.util.Objects;

/**
 * Identifier of an attribute container within a store, formed by the container type name
 * and a store-assigned sequence number. The string form is {@code <type>.<sequence>}.
 *
 * @param name           the container type name
 * @param sequenceNumber the sequence number, unique per type
 */
public record ContainerIdentifier(String name, long sequenceNumber) {

    public ContainerIdentifier {
        Objects.requireNonNull(name, "name must not be null");
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be >= 0");
        }
    }

    /**
     * Parses the string form produced by {@link #toString()}.
     *
     * @param value identifier string such as {@code winevtrc_message_file.3}
     * @return the identifier
     * @throws IllegalArgumentException if the value is not a valid identifier
     */
    public static ContainerIdentifier parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Container identifier must not be null");
        }
        int separator = value.lastIndexOf('.');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Invalid container identifier: '" + value + "'");
        }
        try {
            return new ContainerIdentifier(
                    value.substring(0, separator), Long.parseLong(value.substring(separator + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid container identifier: '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return name + "." + sequenceNumber;
    }
}
