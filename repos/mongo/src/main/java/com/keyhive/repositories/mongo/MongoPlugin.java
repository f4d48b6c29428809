package com.keyhive.repositories.mongo;

import com.keyhive.core.Plugin;
import com.keyhive.core.Storage;
import com.keyhive.core.config.StorageConfig;

import java.util.ArrayList;
import java.util.List;

public class MongoPlugin implements Plugin {
    private final List<Storage> storages = new ArrayList<>();

    @Override
    public synchronized Storage createStorage(StorageConfig sc) {
        MongoConfig config = (MongoConfig) sc;
        MongoHandle handle = MongoHandle.connect(config);
        try {
            MongoStorage storage = new MongoStorage(handle);
            storages.add(storage);
            return storage;
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    @Override
    public synchronized void cleanUp() {
        for (Storage storage : storages) {
            storage.close();
        }
        storages.clear();
    }
}
