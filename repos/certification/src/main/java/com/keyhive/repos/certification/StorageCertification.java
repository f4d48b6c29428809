package com.keyhive.repos.certification;

import com.keyhive.core.*;
import com.keyhive.core.codec.OpenPgpCodec;
import org.bouncycastle.openpgp.PGPKeyPair;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link Storage} backend must show. Subclasses build {@link #storage}
 * on {@link #clock} in {@link #init()} and provide a way to write records that bypasses
 * the mutation pipeline.
 */
public abstract class StorageCertification {
    protected static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    protected Storage storage;
    protected TestClock clock;

    public abstract void init();

    /**
     * Writes {@code record} straight to the backend, without validation or events.
     */
    protected abstract void storeRaw(KeyRecord record);

    @BeforeEach
    public void setUp() {
        clock = new TestClock(START);
        init();
    }

    @AfterEach
    public void tearDown() {
        if (storage != null) {
            storage.close();
        }
    }

    @Test
    public void insertedKeyShouldBeFoundByItsDigest() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        storage.insert(List.of(alice));

        assertEquals(List.of(alice.rfingerprint()), storage.matchByDigest(List.of(alice.digest())));
        assertEquals(List.of(alice.rfingerprint()), storage.matchByDigest(List.of(alice.digest().toUpperCase())));
        assertTrue(storage.matchByDigest(List.of("00000000000000000000000000000000")).isEmpty());
    }

    @Test
    public void insertingTheSameKeyTwiceShouldFail() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        storage.insert(List.of(alice));
        clock.advance(Duration.ofMinutes(1));

        assertThrows(UniquenessViolationException.class, () -> storage.insert(List.of(alice)));

        List<Keyring> stored = storage.fetchKeyrings(List.of(alice.rfingerprint()));
        assertEquals(1, stored.size());
        assertEquals(alice.digest(), stored.get(0).pubkey().digest());
        assertEquals(START, stored.get(0).modifiedAt());
    }

    @Test
    public void insertingAnotherVersionOfAStoredKeyShouldFail() {
        PGPKeyPair pair = TestKeys.keyPair();
        Pubkey original = TestKeys.pubkey(pair, "Alice <alice@example.com>");
        Pubkey revised = TestKeys.pubkey(pair, "Alice <alice@example.org>");
        storage.insert(List.of(original));

        assertThrows(UniquenessViolationException.class, () -> storage.insert(List.of(revised)));

        assertEquals(List.of(original.rfingerprint()), storage.matchByDigest(List.of(original.digest())));
        assertTrue(storage.matchByDigest(List.of(revised.digest())).isEmpty());
    }

    @Test
    public void insertingADigestAlreadyOnRecordShouldFail() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        storeRaw(new KeyRecord(fakeFingerprint('a', 1), 0, 0, alice.digest(), new byte[0], List.of()));

        assertThrows(UniquenessViolationException.class, () -> storage.insert(List.of(alice)));

        assertEquals(List.of(fakeFingerprint('a', 1)), storage.matchByDigest(List.of(alice.digest())));
    }

    @Test
    public void insertShouldStopAtTheFirstFailureAndKeepEarlierKeys() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.com>");
        Pubkey carol = TestKeys.pubkey("Carol <carol@example.com>");
        storage.insert(List.of(alice));

        List<KeyChange> changes = new ArrayList<>();
        storage.subscribe(changes::add);

        assertThrows(UniquenessViolationException.class, () -> storage.insert(List.of(bob, alice, carol)));

        assertEquals(List.of(bob.rfingerprint()), storage.matchByDigest(List.of(bob.digest())));
        assertTrue(storage.matchByDigest(List.of(carol.digest())).isEmpty());
        assertEquals(List.of(new KeyAdded(bob.rfingerprint(), bob.digest())), changes);
    }

    @Test
    public void resolveShouldPassFullLengthIdsThroughUnchecked() {
        String unknown = fakeFingerprint('f', 7);

        assertEquals(List.of(unknown), storage.resolve(List.of(unknown)));
        assertEquals(List.of(unknown), storage.resolve(List.of(unknown.toUpperCase())));
    }

    @Test
    public void resolveShouldExpandPrefixesToEveryMatch() {
        storeRaw(new KeyRecord(fakeFingerprint('a', 1), 0, 0, "d1", new byte[0], List.of()));
        storeRaw(new KeyRecord(fakeFingerprint('a', 2), 0, 0, "d2", new byte[0], List.of()));
        storeRaw(new KeyRecord(fakeFingerprint('b', 3), 0, 0, "d3", new byte[0], List.of()));

        Set<String> resolved = new HashSet<>(storage.resolve(List.of("AAAA")));

        assertEquals(Set.of(fakeFingerprint('a', 1), fakeFingerprint('a', 2)), resolved);
        assertTrue(storage.resolve(List.of("cccc")).isEmpty());
    }

    @Test
    public void resolveShouldFindKeysByReversedKeyId() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.com>");
        storage.insert(List.of(alice, bob));

        String shortId = Fingerprints.reverse(alice.keyId()).substring(0, 8);
        List<String> resolved = storage.resolve(List.of(Fingerprints.reverse(alice.keyId()), bob.rfingerprint()));

        assertEquals(Set.of(alice.rfingerprint(), bob.rfingerprint()), new HashSet<>(resolved));
        assertTrue(storage.resolve(List.of(shortId)).contains(alice.rfingerprint()));
    }

    @Test
    public void resolveShouldIgnoreIdsThatCannotBeFingerprints() {
        storeRaw(new KeyRecord(fakeFingerprint('a', 1), 0, 0, "d1", new byte[0], List.of()));

        assertTrue(storage.resolve(List.of("", ".*", "a.*")).isEmpty());
    }

    @Test
    public void matchByKeywordShouldFindKeysSharingAKeyword() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.org>");
        storage.insert(List.of(alice, bob));

        assertEquals(List.of(alice.rfingerprint()), storage.matchByKeyword(List.of("ALICE")));
        assertEquals(Set.of(alice.rfingerprint(), bob.rfingerprint()),
                new HashSet<>(storage.matchByKeyword(List.of("com", "org"))));
        assertTrue(storage.matchByKeyword(List.of("mallory")).isEmpty());
    }

    @Test
    public void matchByKeywordShouldBeCapped() {
        for (int i = 0; i < Storage.RESULT_LIMIT + 5; i++) {
            storeRaw(new KeyRecord(fakeFingerprint('c', i), 0, 0, "d" + i, new byte[0], List.of("common")));
        }

        assertEquals(Storage.RESULT_LIMIT, storage.matchByKeyword(List.of("common")).size());
    }

    @Test
    public void listModifiedSinceShouldOnlyReturnLaterChanges() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.com>");
        storage.insert(List.of(alice));
        clock.advance(Duration.ofSeconds(10));
        storage.insert(List.of(bob));

        assertEquals(List.of(bob.rfingerprint()), storage.listModifiedSince(START));
        assertEquals(Set.of(alice.rfingerprint(), bob.rfingerprint()),
                new HashSet<>(storage.listModifiedSince(START.minusSeconds(1))));
        assertTrue(storage.listModifiedSince(START.plusSeconds(10)).isEmpty());
    }

    @Test
    public void listModifiedSinceShouldBeCapped() {
        for (int i = 0; i < Storage.RESULT_LIMIT + 5; i++) {
            storeRaw(new KeyRecord(fakeFingerprint('e', i), i, 1000 + i, "d" + i, new byte[0], List.of()));
        }

        assertEquals(Storage.RESULT_LIMIT, storage.listModifiedSince(Instant.ofEpochSecond(999)).size());
        assertEquals(4, storage.listModifiedSince(Instant.ofEpochSecond(1100)).size());
    }

    @Test
    public void fetchKeysShouldDecodeStoredKeys() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        storage.insert(List.of(alice));

        List<Pubkey> keys = storage.fetchKeys(List.of(alice.rfingerprint().toUpperCase(), fakeFingerprint('f', 1)));

        assertEquals(1, keys.size());
        assertEquals(alice.fingerprint(), keys.get(0).fingerprint());
        assertEquals(alice.userIds(), keys.get(0).userIds());
    }

    @Test
    public void fetchKeysShouldFailOnAMislabelledRecord() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.com>");
        storage.insert(List.of(alice));
        storeRaw(new KeyRecord(fakeFingerprint('b', 1), 0, 0, bob.digest(),
                new OpenPgpCodec().serialize(bob), List.of()));

        assertThrows(KeyDecodeException.class,
                () -> storage.fetchKeys(List.of(alice.rfingerprint(), fakeFingerprint('b', 1))));
        assertThrows(KeyDecodeException.class,
                () -> storage.fetchKeyrings(List.of(fakeFingerprint('b', 1))));
    }

    @Test
    public void updateShouldReplaceContentUnderTheCurrentDigest() {
        PGPKeyPair pair = TestKeys.keyPair();
        Pubkey original = TestKeys.pubkey(pair, "Alice <alice@example.com>");
        Pubkey revised = TestKeys.pubkey(pair, "Alice Liddell <liddell@wonderland.example>");
        storage.insert(List.of(original));
        clock.advance(Duration.ofMinutes(5));

        String digest = storage.update(revised, original.digest());

        assertEquals(revised.digest(), digest);
        assertTrue(storage.matchByDigest(List.of(original.digest())).isEmpty());
        assertEquals(List.of(revised.rfingerprint()), storage.matchByDigest(List.of(revised.digest())));
        assertEquals(List.of(revised.rfingerprint()), storage.matchByKeyword(List.of("wonderland")));
        assertTrue(storage.matchByKeyword(List.of("com")).isEmpty());

        Keyring keyring = storage.fetchKeyrings(List.of(original.rfingerprint())).get(0);
        assertEquals(revised.userIds(), keyring.pubkey().userIds());
        assertEquals(START, keyring.createdAt());
        assertEquals(START.plus(Duration.ofMinutes(5)), keyring.modifiedAt());
    }

    @Test
    public void updateWithAStaleDigestShouldConflict() {
        PGPKeyPair pair = TestKeys.keyPair();
        Pubkey original = TestKeys.pubkey(pair, "Alice <alice@example.com>");
        Pubkey first = TestKeys.pubkey(pair, "Alice <alice@first.example>");
        Pubkey second = TestKeys.pubkey(pair, "Alice <alice@second.example>");
        storage.insert(List.of(original));

        storage.update(first, original.digest());
        ConflictException e = assertThrows(ConflictException.class, () -> storage.update(second, original.digest()));

        assertEquals(original.digest(), e.getExpectedDigest());
        assertEquals(List.of(first.rfingerprint()), storage.matchByDigest(List.of(first.digest())));
        assertTrue(storage.matchByDigest(List.of(second.digest())).isEmpty());
    }

    @Test
    public void updateOfAnUnknownDigestShouldConflict() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");

        assertThrows(ConflictException.class, () -> storage.update(alice, "ffffffffffffffffffffffffffffffff"));
        assertTrue(storage.fetchKeys(List.of(alice.rfingerprint())).isEmpty());
    }

    @Test
    public void updateShouldNotTouchAnotherKeyCarryingTheDigest() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.com>");
        storage.insert(List.of(alice, bob));

        assertThrows(ConflictException.class, () -> storage.update(bob, alice.digest()));

        assertEquals(List.of(alice.rfingerprint()), storage.matchByDigest(List.of(alice.digest())));
    }

    @Test
    public void updateToADigestOwnedByAnotherRecordShouldFail() {
        PGPKeyPair pair = TestKeys.keyPair();
        Pubkey original = TestKeys.pubkey(pair, "Alice <alice@example.com>");
        Pubkey revised = TestKeys.pubkey(pair, "Alice <alice@example.org>");
        storage.insert(List.of(original));
        storeRaw(new KeyRecord(fakeFingerprint('a', 1), 0, 0, revised.digest(), new byte[0], List.of()));

        assertThrows(UniquenessViolationException.class, () -> storage.update(revised, original.digest()));

        assertEquals(List.of(original.rfingerprint()), storage.matchByDigest(List.of(original.digest())));
        assertEquals(List.of(fakeFingerprint('a', 1)), storage.matchByDigest(List.of(revised.digest())));
        Keyring keyring = storage.fetchKeyrings(List.of(original.rfingerprint())).get(0);
        assertEquals(original.userIds(), keyring.pubkey().userIds());
        assertEquals(original.digest(), keyring.pubkey().digest());
    }

    @Test
    public void concurrentUpdatesFromTheSameDigestShouldLetOnlyOneWin() throws Exception {
        PGPKeyPair pair = TestKeys.keyPair();
        Pubkey original = TestKeys.pubkey(pair, "Alice <alice@example.com>");
        List<Pubkey> revisions = List.of(
                TestKeys.pubkey(pair, "Alice <alice@one.example>"),
                TestKeys.pubkey(pair, "Alice <alice@two.example>"),
                TestKeys.pubkey(pair, "Alice <alice@three.example>"));
        storage.insert(List.of(original));

        ExecutorService executor = Executors.newFixedThreadPool(revisions.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (Pubkey revision : revisions) {
                Callable<String> update = () -> {
                    start.await();
                    return storage.update(revision, original.digest());
                };
                results.add(executor.submit(update));
            }
            start.countDown();

            int wins = 0;
            int conflicts = 0;
            for (Future<String> result : results) {
                try {
                    result.get();
                    wins++;
                } catch (ExecutionException e) {
                    assertInstanceOf(ConflictException.class, e.getCause());
                    conflicts++;
                }
            }
            assertEquals(1, wins);
            assertEquals(revisions.size() - 1, conflicts);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void subscribersShouldHearEveryInsertAndUpdate() {
        PGPKeyPair pair = TestKeys.keyPair();
        Pubkey alice = TestKeys.pubkey(pair, "Alice <alice@example.com>");
        Pubkey revised = TestKeys.pubkey(pair, "Alice <alice@example.org>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.com>");

        List<KeyChange> changes = new ArrayList<>();
        storage.subscribe(changes::add);

        storage.insert(List.of(alice, bob));
        storage.update(revised, alice.digest());
        assertThrows(ConflictException.class, () -> storage.update(revised, alice.digest()));

        assertEquals(List.of(
                new KeyAdded(alice.rfingerprint(), alice.digest()),
                new KeyAdded(bob.rfingerprint(), bob.digest()),
                new KeyReplaced(alice.rfingerprint(), alice.digest(), revised.digest())), changes);
    }

    @Test
    public void failingSubscriberShouldNotAffectMutations() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        storage.subscribe(change -> {
            throw new IllegalStateException("subscriber down");
        });

        assertDoesNotThrow(() -> storage.insert(List.of(alice)));
        assertEquals(List.of(alice.rfingerprint()), storage.matchByDigest(List.of(alice.digest())));
    }

    @Test
    public void nullSubscriberShouldBeRejectedWithoutBreakingInserts() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.com>");

        assertThrows(NullPointerException.class, () -> storage.subscribe(null));

        assertDoesNotThrow(() -> storage.insert(List.of(alice, bob)));
        assertEquals(2, storage.fetchKeys(List.of(alice.rfingerprint(), bob.rfingerprint())).size());
    }

    @Test
    public void publishShouldReachSubscribers() {
        List<KeyChange> changes = new ArrayList<>();
        storage.subscribe(changes::add);

        storage.publish(new KeyAdded("abc", "d1"));

        assertEquals(List.of(new KeyAdded("abc", "d1")), changes);
    }

    /**
     * A 40 character fingerprint of {@code fill} ending in {@code n}.
     */
    protected static String fakeFingerprint(char fill, int n) {
        String suffix = String.format("%04d", n);
        return String.valueOf(fill).repeat(Fingerprints.LENGTH - suffix.length()) + suffix;
    }
}
