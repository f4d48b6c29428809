package com.keyhive.repositories.mongo;

import com.keyhive.core.Pubkey;
import com.keyhive.core.Storage;
import com.keyhive.core.TestKeys;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MongoPluginTest {
    private MongoServer server;
    private String uri;
    private MongoPlugin plugin;

    @BeforeEach
    public void setUp() {
        server = new MongoServer(new MemoryBackend());
        uri = server.bindAndGetConnectionString();
        plugin = new MongoPlugin();
    }

    @AfterEach
    public void tearDown() {
        plugin.cleanUp();
        server.shutdownNow();
    }

    @Test
    public void storagesOnTheSameCollectionShouldShareRecords() {
        MongoConfig config = new MongoConfig();
        config.uri = uri;
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");

        Storage writer = plugin.createStorage(config);
        Storage reader = plugin.createStorage(config);
        writer.insert(List.of(alice));

        assertEquals(List.of(alice.rfingerprint()), reader.matchByDigest(List.of(alice.digest())));
        assertEquals(alice.userIds(), reader.fetchKeys(List.of(alice.rfingerprint())).get(0).userIds());
    }

    @Test
    public void storagesOnDifferentCollectionsShouldBeIsolated() {
        MongoConfig first = new MongoConfig();
        first.uri = uri;
        MongoConfig second = new MongoConfig();
        second.uri = uri;
        second.collection = "other_keys";
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");

        plugin.createStorage(first).insert(List.of(alice));

        assertTrue(plugin.createStorage(second).matchByDigest(List.of(alice.digest())).isEmpty());
    }
}
