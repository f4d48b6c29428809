package com.keyhive.repositories.mongo;

import com.keyhive.core.KeyIndexes;
import com.keyhive.core.StorageException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the indexes declared in {@link KeyIndexes} if they do not exist yet.
 */
public final class MongoIndexes {
    private static final Logger logger = LoggerFactory.getLogger(MongoIndexes.class);

    private MongoIndexes() {
    }

    /**
     * @throws StorageException on the first index that cannot be created, for example
     *                          because stored data already violates a unique index
     */
    public static void ensure(MongoCollection<Document> collection) {
        for (KeyIndexes.IndexSpec spec : KeyIndexes.ALL) {
            try {
                String name = collection.createIndex(Indexes.ascending(spec.field()), options(spec));
                logger.debug("Ensured index {} on {}", name, collection.getNamespace());
            } catch (MongoException e) {
                logger.error("Failed to ensure index on {}: {}", spec.field(), e.getMessage(), e);
                throw new StorageException("Failed to ensure index on " + spec.field(), e);
            }
        }
    }

    static IndexOptions options(KeyIndexes.IndexSpec spec) {
        return new IndexOptions().unique(spec.unique()).background(spec.background());
    }
}
