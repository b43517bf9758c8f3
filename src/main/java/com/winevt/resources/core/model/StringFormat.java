package com.winevt.resources.core.model;

/**
 * Placeholder convention of stored message strings.
 */
public enum StringFormat {
    /** Windows resource compiler form, such as {@code %1}. Needs conversion before use. */
    WRC("wrc"),
    /** Positional form, such as {@code {0}}. */
    PEP3101("pep3101");

    private final String value;

    StringFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Looks up a string format by its stored value.
     *
     * @param value the stored value
     * @return the format, or null if the value is not recognized
     */
    public static StringFormat fromValue(String value) {
        for (StringFormat format : values()) {
            if (format.value.equals(value)) {
                return format;
            }
        }
        return null;
    }
}
