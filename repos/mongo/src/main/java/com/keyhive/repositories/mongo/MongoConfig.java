package com.keyhive.repositories.mongo;

import com.keyhive.core.config.StorageConfig;

import java.util.Map;

public class MongoConfig extends StorageConfig {
    public static final String DEFAULT_URI = "mongodb://localhost:27017";
    public static final String DEFAULT_DB = "hkp";
    public static final String DEFAULT_COLLECTION = "keys";

    public String uri = DEFAULT_URI;
    public String db = DEFAULT_DB;
    public String collection = DEFAULT_COLLECTION;

    public MongoConfig() {
        super("mongo");
    }

    /**
     * Reads {@code KEYHIVE_MONGO_URI}, {@code KEYHIVE_MONGO_DB} and
     * {@code KEYHIVE_MONGO_COLLECTION}, falling back to the defaults.
     */
    public static MongoConfig fromEnvironment(Map<String, String> env) {
        MongoConfig config = new MongoConfig();
        config.uri = env.getOrDefault("KEYHIVE_MONGO_URI", DEFAULT_URI);
        config.db = env.getOrDefault("KEYHIVE_MONGO_DB", DEFAULT_DB);
        config.collection = env.getOrDefault("KEYHIVE_MONGO_COLLECTION", DEFAULT_COLLECTION);
        return config;
    }

    @Override
    public String toString() {
        return "MongoConfig{uri=" + uri + ", db=" + db + ", collection=" + collection + "}";
    }
}
