package com.winevt.resources.store;

/**
 * Value types an attribute container schema can declare.
 */
public enum AttributeType {
    STRING,
    INTEGER,
    STRING_LIST,
    IDENTIFIER
}
