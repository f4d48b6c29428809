package com.keyhive.repositories.memory;

import com.keyhive.core.Pubkey;
import com.keyhive.core.Storage;
import com.keyhive.core.TestKeys;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryPluginTest {

    @Test
    public void storagesFromOnePluginShouldShareTheirRecords() {
        InMemoryPlugin plugin = new InMemoryPlugin();
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");

        try (Storage writer = plugin.createStorage(null); Storage reader = plugin.createStorage(null)) {
            writer.insert(List.of(alice));

            assertEquals(List.of(alice.rfingerprint()), reader.matchByDigest(List.of(alice.digest())));
        } finally {
            plugin.cleanUp();
        }
    }

    @Test
    public void storagesFromDifferentPluginsShouldBeIsolated() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");

        try (Storage first = new InMemoryPlugin().createStorage(null);
             Storage second = new InMemoryPlugin().createStorage(null)) {
            first.insert(List.of(alice));

            assertTrue(second.matchByDigest(List.of(alice.digest())).isEmpty());
        }
    }
}
