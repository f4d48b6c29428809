package com.keyhive.core;

/**
 * An update presented a digest that is no longer, or never was, on record.
 */
public class ConflictException extends StorageException {
    private final String rfingerprint;
    private final String expectedDigest;

    public ConflictException(String rfingerprint, String expectedDigest) {
        super(String.format("Failed to update %s, no record matched lastMD5=%s", rfingerprint, expectedDigest));
        this.rfingerprint = rfingerprint;
        this.expectedDigest = expectedDigest;
    }

    public String getRfingerprint() {
        return rfingerprint;
    }

    public String getExpectedDigest() {
        return expectedDigest;
    }
}
