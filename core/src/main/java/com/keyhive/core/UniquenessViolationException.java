package com.keyhive.core;

/**
 * A write would have stored a second record with the same fingerprint or digest.
 */
public class UniquenessViolationException extends StorageException {
    private final String rfingerprint;
    private final String digest;

    public UniquenessViolationException(String rfingerprint, String digest, Throwable cause) {
        super(String.format("Duplicate key %s (md5=%s)", rfingerprint, digest), cause);
        this.rfingerprint = rfingerprint;
        this.digest = digest;
    }

    public String getRfingerprint() {
        return rfingerprint;
    }

    public String getDigest() {
        return digest;
    }
}
