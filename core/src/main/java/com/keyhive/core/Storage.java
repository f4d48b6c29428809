package com.keyhive.core;

import java.time.Instant;
import java.util.List;

/**
 * Query, mutation and change notification over stored keys.
 * <p>
 * Identifiers are reversed lowercase hex fingerprints (see {@link Pubkey#rfingerprint()}).
 * Inputs are lowercased before use and never modified. Every operation runs to
 * completion on the calling thread; backend failures surface as {@link StorageException}
 * and are not retried.
 */
public interface Storage extends AutoCloseable {
    /**
     * Cap applied to keyword, modification-time and fetch queries.
     */
    int RESULT_LIMIT = 100;

    /**
     * Fingerprints of every record whose digest is in {@code digests}.
     */
    List<String> matchByDigest(List<String> digests);

    /**
     * Expands identifiers to full reversed fingerprints. Full-length identifiers are
     * returned as given without checking that they are stored; shorter ones are
     * replaced by every stored fingerprint they prefix.
     */
    List<String> resolve(List<String> ids);

    /**
     * Fingerprints of up to {@link #RESULT_LIMIT} records sharing a keyword with {@code keywords}.
     */
    List<String> matchByKeyword(List<String> keywords);

    /**
     * Fingerprints of up to {@link #RESULT_LIMIT} records modified strictly after {@code since},
     * in no particular order. Callers page by advancing {@code since}.
     */
    List<String> listModifiedSince(Instant since);

    /**
     * @throws KeyDecodeException if any matching record fails to decode
     */
    List<Pubkey> fetchKeys(List<String> rfingerprints);

    /**
     * @throws KeyDecodeException if any matching record fails to decode
     */
    List<Keyring> fetchKeyrings(List<String> rfingerprints);

    /**
     * Inserts each key in turn, publishing a {@link KeyAdded} after each one. Stops at
     * the first failure; keys already inserted stay inserted.
     *
     * @throws UniquenessViolationException if a fingerprint or digest is already stored
     */
    void insert(List<Pubkey> keys);

    /**
     * Replaces the stored content of {@code key} if its record still carries
     * {@code lastDigest}, and publishes a {@link KeyReplaced}.
     *
     * @return the new digest
     * @throws ConflictException if no record of this key carries {@code lastDigest}
     */
    String update(Pubkey key, String lastDigest);

    void subscribe(KeyChangeListener listener);

    /**
     * Delivers {@code change} to every subscriber.
     */
    void publish(KeyChange change);

    @Override
    void close();
}
