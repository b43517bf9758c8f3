package com.winevt.resources.sqlite;

/**
 * Runtime exception raised when a resource database query fails.
 */
public class ResourceDatabaseException extends RuntimeException {

    public ResourceDatabaseException(String message) {
        super(message);
    }

    public ResourceDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
