package com.keyhive.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The persisted shape of one key. Backends store exactly one record per fingerprint.
 * Packets are copied in and out, and records compare by content.
 *
 * @param rfingerprint reversed lowercase hex fingerprint, unique
 * @param createdAt    epoch seconds of the first insert
 * @param modifiedAt   epoch seconds of the last insert or update
 * @param digest       lowercase hex digest of {@code packets}, unique; doubles as the update token
 * @param packets      serialized keyring
 * @param keywords     lowercase search tokens from the key's user ids
 */
public record KeyRecord(
        String rfingerprint,
        long createdAt,
        long modifiedAt,
        String digest,
        byte[] packets,
        List<String> keywords
) {
    public static final String RFINGERPRINT = "rfingerprint";
    public static final String CTIME = "ctime";
    public static final String MTIME = "mtime";
    public static final String DIGEST = "md5";
    public static final String PACKETS = "packets";
    public static final String KEYWORDS = "keywords";

    public KeyRecord {
        packets = Objects.requireNonNull(packets, "packets").clone();
    }

    @Override
    public byte[] packets() {
        return packets.clone();
    }

    public KeyRecord withCreatedAt(long createdAt) {
        return new KeyRecord(rfingerprint, createdAt, modifiedAt, digest, packets, keywords);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyRecord)) {
            return false;
        }
        KeyRecord other = (KeyRecord) o;
        return createdAt == other.createdAt
                && modifiedAt == other.modifiedAt
                && Objects.equals(rfingerprint, other.rfingerprint)
                && Objects.equals(digest, other.digest)
                && Arrays.equals(packets, other.packets)
                && Objects.equals(keywords, other.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rfingerprint, createdAt, modifiedAt, digest, Arrays.hashCode(packets), keywords);
    }

    @Override
    public String toString() {
        return "KeyRecord[rfingerprint=" + rfingerprint + ", createdAt=" + createdAt
                + ", modifiedAt=" + modifiedAt + ", digest=" + digest
                + ", packets=" + packets.length + " bytes, keywords=" + keywords + "]";
    }
}
