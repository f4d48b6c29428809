package com.keyhive.repositories.mongo;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MongoConfigTest {

    @Test
    public void shouldDefaultToTheHkpKeysCollection() {
        MongoConfig config = MongoConfig.fromEnvironment(Map.of());

        assertEquals("mongo", config.type);
        assertEquals("mongodb://localhost:27017", config.uri);
        assertEquals("hkp", config.db);
        assertEquals("keys", config.collection);
    }

    @Test
    public void environmentShouldOverrideTheDefaults() {
        MongoConfig config = MongoConfig.fromEnvironment(Map.of(
                "KEYHIVE_MONGO_URI", "mongodb://db.internal:27018",
                "KEYHIVE_MONGO_DB", "keyserver",
                "KEYHIVE_MONGO_COLLECTION", "pubkeys"));

        assertEquals("mongodb://db.internal:27018", config.uri);
        assertEquals("keyserver", config.db);
        assertEquals("pubkeys", config.collection);
    }
}
