package com.winevt.resources.sqlite;

/**
 * Thrown at open time when a resource database has an unsupported version or string format.
 */
public class UnsupportedDatabaseFormatException extends ResourceDatabaseException {

    private final String attributeName;
    private final String attributeValue;

    public UnsupportedDatabaseFormatException(String attributeName, String attributeValue) {
        super("Unsupported " + attributeName.replace('_', ' ') + ": " + attributeValue);
        this.attributeName = attributeName;
        this.attributeValue = attributeValue;
    }

    public String getAttributeName() {
        return attributeName;
    }

    /**
     * The stored value, or null when the attribute is absent.
     */
    public String getAttributeValue() {
        return attributeValue;
    }
}
