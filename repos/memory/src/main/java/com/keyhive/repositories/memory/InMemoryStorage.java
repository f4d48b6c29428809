package com.keyhive.repositories.memory;

import com.keyhive.core.*;
import com.keyhive.core.codec.KeyCodec;
import com.keyhive.core.codec.OpenPgpCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A {@link Storage} backed by an {@link InMemoryStore}. Suitable for embedding and tests;
 * nothing survives the process.
 */
public class InMemoryStorage implements Storage {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryStorage.class);

    private final InMemoryStore store;
    private final KeyRecords records;
    private final KeyChangeBus bus = new KeyChangeBus();

    public InMemoryStorage() {
        this(new InMemoryStore(), new OpenPgpCodec(), Clock.systemUTC());
    }

    public InMemoryStorage(InMemoryStore store, KeyCodec codec, Clock clock) {
        this.store = store;
        this.records = new KeyRecords(codec, clock);
    }

    @Override
    public List<String> matchByDigest(List<String> digests) {
        Set<String> wanted = new HashSet<>(Fingerprints.lowercase(digests));
        return fingerprints(record -> wanted.contains(record.digest()), Long.MAX_VALUE);
    }

    @Override
    public List<String> resolve(List<String> ids) {
        Fingerprints.Resolution resolution = Fingerprints.split(ids);
        List<String> result = new ArrayList<>(resolution.resolved());
        if (!resolution.prefixes().isEmpty()) {
            result.addAll(fingerprints(record -> resolution.prefixes().stream()
                    .anyMatch(prefix -> record.rfingerprint().startsWith(prefix)), Long.MAX_VALUE));
        }
        return result;
    }

    @Override
    public List<String> matchByKeyword(List<String> keywords) {
        Set<String> wanted = new HashSet<>(Fingerprints.lowercase(keywords));
        return fingerprints(record -> record.keywords().stream().anyMatch(wanted::contains), RESULT_LIMIT);
    }

    @Override
    public List<String> listModifiedSince(Instant since) {
        long seconds = since.getEpochSecond();
        return fingerprints(record -> record.modifiedAt() > seconds, RESULT_LIMIT);
    }

    @Override
    public List<Pubkey> fetchKeys(List<String> rfingerprints) {
        return find(rfingerprints).stream()
                .map(record -> records.fromRecord(record.packets(), record.rfingerprint()))
                .collect(Collectors.toList());
    }

    @Override
    public List<Keyring> fetchKeyrings(List<String> rfingerprints) {
        return find(rfingerprints).stream()
                .map(records::toKeyring)
                .collect(Collectors.toList());
    }

    @Override
    public void insert(List<Pubkey> keys) {
        for (Pubkey key : keys) {
            KeyRecord record = records.toRecord(key);
            store.insert(record);
            logger.debug("Inserted {} md5={}", record.rfingerprint(), record.digest());
            bus.publish(new KeyAdded(record.rfingerprint(), record.digest()));
        }
    }

    @Override
    public String update(Pubkey key, String lastDigest) {
        KeyRecord record = records.toRecord(key);
        String expected = lastDigest.toLowerCase(Locale.ROOT);
        store.replace(expected, record)
                .orElseThrow(() -> new ConflictException(record.rfingerprint(), expected));
        logger.debug("Updated {} md5={} -> {}", record.rfingerprint(), expected, record.digest());
        bus.publish(new KeyReplaced(record.rfingerprint(), expected, record.digest()));
        return record.digest();
    }

    @Override
    public void subscribe(KeyChangeListener listener) {
        bus.subscribe(listener);
    }

    @Override
    public void publish(KeyChange change) {
        bus.publish(change);
    }

    @Override
    public void close() {
        // Nothing to release
    }

    private List<KeyRecord> find(List<String> rfingerprints) {
        Set<String> wanted = new HashSet<>(Fingerprints.lowercase(rfingerprints));
        return store.snapshot().stream()
                .filter(record -> wanted.contains(record.rfingerprint()))
                .limit(RESULT_LIMIT)
                .collect(Collectors.toList());
    }

    private List<String> fingerprints(Predicate<KeyRecord> filter, long limit) {
        return store.snapshot().stream()
                .filter(filter)
                .limit(limit)
                .map(KeyRecord::rfingerprint)
                .collect(Collectors.toList());
    }
}
