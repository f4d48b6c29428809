package com.keyhive.repositories.memory;

import com.keyhive.core.KeyRecord;
import com.keyhive.core.codec.OpenPgpCodec;
import com.keyhive.repos.certification.StorageCertification;

public class InMemoryStorageCertificationTest extends StorageCertification {
    private InMemoryStore store;

    @Override
    public void init() {
        store = new InMemoryStore();
        storage = new InMemoryStorage(store, new OpenPgpCodec(), clock);
    }

    @Override
    protected void storeRaw(KeyRecord record) {
        store.insert(record);
    }
}
