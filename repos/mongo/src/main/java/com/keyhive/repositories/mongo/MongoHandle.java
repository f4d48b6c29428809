package com.keyhive.repositories.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a client to the database and collection holding key records.
 * <p>
 * Operations call {@link #collection()} each time they run. The driver checks a pooled
 * connection out per command and returns it when the command (or the cursor, which
 * callers close) completes, so no connection outlives the operation that used it.
 */
public class MongoHandle implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MongoHandle.class);

    private final MongoClient client;
    private final String dbName;
    private final String collectionName;
    private final boolean ownsClient;

    /**
     * @param ownsClient whether {@link #close()} should close {@code client}
     */
    public MongoHandle(MongoClient client, String dbName, String collectionName, boolean ownsClient) {
        this.client = client;
        this.dbName = dbName;
        this.collectionName = collectionName;
        this.ownsClient = ownsClient;
    }

    public static MongoHandle connect(MongoConfig config) {
        logger.info("Connecting to {}", config);
        return new MongoHandle(MongoClients.create(config.uri), config.db, config.collection, true);
    }

    public MongoCollection<Document> collection() {
        return client.getDatabase(dbName).getCollection(collectionName);
    }

    public String namespace() {
        return dbName + "." + collectionName;
    }

    @Override
    public void close() {
        if (ownsClient) {
            client.close();
            logger.info("Closed MongoDB connection for {}", namespace());
        }
    }
}
