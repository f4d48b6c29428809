package com.keyhive.core;

/**
 * A failure of the storage backend or of the data it returned.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
