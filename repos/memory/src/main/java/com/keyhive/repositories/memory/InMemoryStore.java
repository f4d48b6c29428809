package com.keyhive.repositories.memory;

import com.keyhive.core.KeyRecord;
import com.keyhive.core.UniquenessViolationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records held in memory, unique by fingerprint and by digest.
 * Writes are serialized on this store; reads see a snapshot.
 */
public class InMemoryStore {
    private final Map<String, KeyRecord> records = new LinkedHashMap<>();
    private final Map<String, String> fingerprintsByDigest = new HashMap<>();

    public synchronized void insert(KeyRecord record) {
        if (records.containsKey(record.rfingerprint()) || fingerprintsByDigest.containsKey(record.digest())) {
            throw new UniquenessViolationException(record.rfingerprint(), record.digest(), null);
        }
        records.put(record.rfingerprint(), record);
        fingerprintsByDigest.put(record.digest(), record.rfingerprint());
    }

    /**
     * Swaps in {@code replacement} if the record for its fingerprint currently carries
     * {@code lastDigest}. The stored creation time is kept.
     *
     * @return the stored record, or empty if the precondition did not hold
     */
    public synchronized Optional<KeyRecord> replace(String lastDigest, KeyRecord replacement) {
        KeyRecord current = records.get(replacement.rfingerprint());
        if (current == null || !current.digest().equals(lastDigest)) {
            return Optional.empty();
        }
        String owner = fingerprintsByDigest.get(replacement.digest());
        if (owner != null && !owner.equals(replacement.rfingerprint())) {
            throw new UniquenessViolationException(replacement.rfingerprint(), replacement.digest(), null);
        }

        KeyRecord stored = replacement.withCreatedAt(current.createdAt());
        fingerprintsByDigest.remove(current.digest());
        fingerprintsByDigest.put(stored.digest(), stored.rfingerprint());
        records.put(stored.rfingerprint(), stored);
        return Optional.of(stored);
    }

    public synchronized List<KeyRecord> snapshot() {
        return new ArrayList<>(records.values());
    }
}
