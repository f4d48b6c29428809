package com.keyhive.core;

/**
 * Key material could not be decoded, or decoded to something other than the one key
 * its record claims to hold.
 */
public class KeyDecodeException extends StorageException {
    public KeyDecodeException(String message) {
        super(message);
    }

    public KeyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
