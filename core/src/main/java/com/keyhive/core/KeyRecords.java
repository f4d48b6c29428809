package com.keyhive.core;

import com.keyhive.core.codec.KeyCodec;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Converts between {@link Pubkey} and {@link KeyRecord}.
 */
public class KeyRecords {
    private final KeyCodec codec;
    private final Clock clock;

    public KeyRecords(KeyCodec codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Builds a record stamped with the current time for both timestamps. Updates keep
     * the stored creation time and take everything else from this record. The digest
     * is the codec's digest of the packets being stored.
     */
    public KeyRecord toRecord(Pubkey key) {
        long now = clock.instant().getEpochSecond();
        byte[] packets = codec.serialize(key);
        return new KeyRecord(
                key.rfingerprint(),
                now,
                now,
                codec.digest(packets),
                packets,
                List.copyOf(Keywords.of(key)));
    }

    /**
     * Decodes stored packets, which must hold exactly one key whose reversed
     * fingerprint is {@code rfingerprint}.
     *
     * @throws KeyDecodeException if the packets are malformed, hold zero or several
     *                            keys, or belong to a different key
     */
    public Pubkey fromRecord(byte[] packets, String rfingerprint) {
        List<Pubkey> keys = codec.parse(packets);
        if (keys.isEmpty()) {
            throw new KeyDecodeException("No key in record " + rfingerprint);
        }
        if (keys.size() > 1) {
            throw new KeyDecodeException(String.format("Multiple keys in record %s: %s, %s",
                    rfingerprint, keys.get(0).fingerprint(), keys.get(1).fingerprint()));
        }
        Pubkey key = keys.get(0);
        if (!key.rfingerprint().equals(rfingerprint)) {
            throw new KeyDecodeException(String.format("RFingerprint mismatch: expected=%s got=%s",
                    rfingerprint, key.rfingerprint()));
        }
        return key;
    }

    public Keyring toKeyring(KeyRecord record) {
        return new Keyring(
                fromRecord(record.packets(), record.rfingerprint()),
                Instant.ofEpochSecond(record.createdAt()),
                Instant.ofEpochSecond(record.modifiedAt()));
    }
}
