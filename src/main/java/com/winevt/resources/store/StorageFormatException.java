package com.winevt.resources.store;

import java.io.IOException;

/**
 * Thrown when a store cannot be opened because its metadata is missing,
 * its format version is incompatible or a format value is not supported.
 */
public class StorageFormatException extends IOException {

    public StorageFormatException(String message) {
        super(message);
    }

    public StorageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
