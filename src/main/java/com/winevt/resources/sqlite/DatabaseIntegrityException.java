package com.winevt.resources.sqlite;

/**
 * Thrown when a resource database holds more than one row where exactly one is expected.
 * This indicates a corrupt database rather than a missing value.
 */
public class DatabaseIntegrityException extends ResourceDatabaseException {

    public DatabaseIntegrityException(String message) {
        super(message);
    }
}
