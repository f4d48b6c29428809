package com.keyhive.repositories.mongo;

import com.keyhive.core.KeyIndexes;
import com.keyhive.core.StorageException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexOptions;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import org.bson.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MongoIndexesTest {
    private static MongoServer server;
    private static MongoClient mongoClient;

    @BeforeAll
    public static void startMongo() {
        server = new MongoServer(new MemoryBackend());
        mongoClient = MongoClients.create(server.bindAndGetConnectionString());
    }

    @AfterAll
    public static void stopMongo() {
        mongoClient.close();
        server.shutdownNow();
    }

    @Test
    public void ensureShouldCreateTheUniqueIndexes() {
        MongoCollection<Document> collection = mongoClient.getDatabase("test_db").getCollection("indexes");

        MongoIndexes.ensure(collection);

        Map<String, Document> indexes = collection.listIndexes().into(new ArrayList<>()).stream()
                .collect(Collectors.toMap(index -> index.getString("name"), index -> index));
        assertTrue(indexes.containsKey("rfingerprint_1"), indexes.keySet().toString());
        assertTrue(indexes.containsKey("md5_1"), indexes.keySet().toString());
        assertEquals(Boolean.TRUE, indexes.get("rfingerprint_1").get("unique"));
        assertEquals(Boolean.TRUE, indexes.get("md5_1").get("unique"));
    }

    @Test
    public void optionsShouldFollowTheDeclaredIndexes() {
        Map<String, IndexOptions> options = KeyIndexes.ALL.stream()
                .collect(Collectors.toMap(KeyIndexes.IndexSpec::field, MongoIndexes::options));

        assertEquals(Set.of("rfingerprint", "md5", "mtime", "keywords"), options.keySet());
        assertTrue(options.get("rfingerprint").isUnique());
        assertTrue(options.get("md5").isUnique());
        assertFalse(options.get("mtime").isUnique());
        assertFalse(options.get("mtime").isBackground());
        assertFalse(options.get("keywords").isUnique());
        assertTrue(options.get("keywords").isBackground());
    }

    @Test
    public void ensureShouldFailWhenStoredRecordsShareAFingerprint() {
        MongoCollection<Document> collection = mongoClient.getDatabase("test_db").getCollection("duplicates");
        String rfingerprint = "a".repeat(40);
        collection.insertOne(new Document("rfingerprint", rfingerprint).append("md5", "01"));
        collection.insertOne(new Document("rfingerprint", rfingerprint).append("md5", "02"));

        StorageException e = assertThrows(StorageException.class, () -> MongoIndexes.ensure(collection));

        assertTrue(e.getMessage().contains("rfingerprint"), e.getMessage());
    }

    @Test
    public void ensureShouldBeIdempotent() {
        MongoCollection<Document> collection = mongoClient.getDatabase("test_db").getCollection("twice");

        MongoIndexes.ensure(collection);

        assertDoesNotThrow(() -> MongoIndexes.ensure(collection));
    }
}
