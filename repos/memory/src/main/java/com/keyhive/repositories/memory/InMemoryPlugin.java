package com.keyhive.repositories.memory;

import com.keyhive.core.Plugin;
import com.keyhive.core.Storage;
import com.keyhive.core.codec.OpenPgpCodec;
import com.keyhive.core.config.StorageConfig;

import java.time.Clock;

/**
 * Hands out storages sharing one {@link InMemoryStore}; the configuration is ignored.
 */
public class InMemoryPlugin implements Plugin {
    private final InMemoryStore store = new InMemoryStore();

    @Override
    public Storage createStorage(StorageConfig config) {
        return new InMemoryStorage(store, new OpenPgpCodec(), Clock.systemUTC());
    }

    @Override
    public void cleanUp() {
        // No cleanup needed
    }
}
