package com.keyhive.repositories.mongo;

import com.keyhive.core.*;
import com.keyhive.core.codec.KeyCodec;
import com.keyhive.core.codec.OpenPgpCodec;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoServerException;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Updates;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.keyhive.core.KeyRecord.*;
import static com.keyhive.repositories.mongo.Converters.documentToRecord;
import static com.keyhive.repositories.mongo.Converters.recordToDocument;

/**
 * MongoDB implementation of {@link Storage}, one document per key.
 * <p>
 * Uniqueness of fingerprints and digests is enforced by the indexes ensured at
 * construction; the update precondition is checked and applied by a single
 * find-and-modify.
 */
public class MongoStorage implements Storage {
    private static final Logger logger = LoggerFactory.getLogger(MongoStorage.class);

    private final MongoHandle handle;
    private final KeyRecords records;
    private final KeyChangeBus bus = new KeyChangeBus();

    public MongoStorage(MongoHandle handle) {
        this(handle, new OpenPgpCodec(), Clock.systemUTC());
    }

    /**
     * @throws StorageException if the indexes cannot be ensured
     */
    public MongoStorage(MongoHandle handle, KeyCodec codec, Clock clock) {
        this.handle = handle;
        this.records = new KeyRecords(codec, clock);
        MongoIndexes.ensure(handle.collection());
    }

    @Override
    public List<String> matchByDigest(List<String> digests) {
        return fingerprints("match digests", Filters.in(DIGEST, Fingerprints.lowercase(digests)), 0);
    }

    // Only v4 key ids resolve; v3 short and long ids will not match.
    @Override
    public List<String> resolve(List<String> ids) {
        Fingerprints.Resolution resolution = Fingerprints.split(ids);
        List<String> result = new ArrayList<>(resolution.resolved());

        if (!resolution.prefixes().isEmpty()) {
            List<Bson> regexes = resolution.prefixes().stream()
                    .map(prefix -> Filters.regex(RFINGERPRINT, "^" + prefix))
                    .collect(Collectors.toList());
            result.addAll(fingerprints("resolve " + resolution.prefixes(), Filters.or(regexes), 0));
        }
        return result;
    }

    @Override
    public List<String> matchByKeyword(List<String> keywords) {
        return fingerprints("match keywords", Filters.in(KEYWORDS, Fingerprints.lowercase(keywords)), RESULT_LIMIT);
    }

    @Override
    public List<String> listModifiedSince(Instant since) {
        return fingerprints("list modified since " + since, Filters.gt(MTIME, since.getEpochSecond()), RESULT_LIMIT);
    }

    @Override
    public List<Pubkey> fetchKeys(List<String> rfingerprints) {
        return fetch(rfingerprints, record -> records.fromRecord(record.packets(), record.rfingerprint()));
    }

    @Override
    public List<Keyring> fetchKeyrings(List<String> rfingerprints) {
        return fetch(rfingerprints, records::toKeyring);
    }

    @Override
    public void insert(List<Pubkey> keys) {
        for (Pubkey key : keys) {
            KeyRecord record = records.toRecord(key);
            try {
                handle.collection().withWriteConcern(WriteConcern.MAJORITY).insertOne(recordToDocument(record));
            } catch (MongoException e) {
                throw writeFailure("insert", record, e);
            }
            bus.publish(new KeyAdded(record.rfingerprint(), record.digest()));
        }
    }

    @Override
    public String update(Pubkey key, String lastDigest) {
        KeyRecord record = records.toRecord(key);
        String expected = lastDigest.toLowerCase(Locale.ROOT);

        Bson filter = Filters.and(
                Filters.eq(DIGEST, expected),
                Filters.eq(RFINGERPRINT, record.rfingerprint()));
        Bson update = Updates.combine(
                Updates.set(MTIME, record.modifiedAt()),
                Updates.set(KEYWORDS, record.keywords()),
                Updates.set(PACKETS, new Binary(record.packets())),
                Updates.set(DIGEST, record.digest()));

        Document updated;
        try {
            updated = handle.collection().withWriteConcern(WriteConcern.MAJORITY).findOneAndUpdate(
                    filter, update, new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER));
        } catch (MongoException e) {
            throw writeFailure("update", record, e);
        }
        if (updated == null) {
            logger.warn("Failed to update {}: md5={} didn't match lastMD5={}",
                    record.rfingerprint(), record.digest(), expected);
            throw new ConflictException(record.rfingerprint(), expected);
        }

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
        handle.close();
    }

    private List<String> fingerprints(String operation, Bson filter, int limit) {
        List<String> result = new ArrayList<>();
        try (MongoCursor<Document> cursor = handle.collection().find(filter)
                .projection(Projections.include(RFINGERPRINT))
                .limit(limit)
                .iterator()) {
            while (cursor.hasNext()) {
                result.add(cursor.next().getString(RFINGERPRINT));
            }
        } catch (MongoException e) {
            logger.error("Error trying to {}: {}", operation, e.getMessage(), e);
            throw new StorageException("Failed to " + operation, e);
        }
        return result;
    }

    /**
     * Decodes every matching record; the first decode failure aborts the whole call.
     */
    private <T> List<T> fetch(List<String> rfingerprints, Function<KeyRecord, T> decode) {
        List<String> wanted = Fingerprints.lowercase(rfingerprints);
        List<T> result = new ArrayList<>();
        try (MongoCursor<Document> cursor = handle.collection().find(Filters.in(RFINGERPRINT, wanted))
                .limit(RESULT_LIMIT)
                .iterator()) {
            while (cursor.hasNext()) {
                result.add(decode.apply(documentToRecord(cursor.next())));
            }
        } catch (MongoException e) {
            logger.error("Error fetching {}: {}", wanted, e.getMessage(), e);
            throw new StorageException("Failed to fetch " + wanted, e);
        } catch (KeyDecodeException e) {
            logger.error("Corrupt record among {}: {}", wanted, e.getMessage());
            throw e;
        }
        return result;
    }

    private StorageException writeFailure(String operation, KeyRecord record, MongoException e) {
        if (e instanceof MongoServerException
                && ErrorCategory.fromErrorCode(((MongoServerException) e).getCode()) == ErrorCategory.DUPLICATE_KEY) {
            logger.error("Failed to {} {}: duplicate fingerprint or md5={}", operation, record.rfingerprint(), record.digest());
            return new UniquenessViolationException(record.rfingerprint(), record.digest(), e);
        }
        logger.error("Error trying to {} {}: {}", operation, record.rfingerprint(), e.getMessage(), e);
        return new StorageException(String.format("Failed to %s %s", operation, record.rfingerprint()), e);
    }
}
