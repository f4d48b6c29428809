package com.keyhive.core;

import com.keyhive.core.config.StorageConfig;

public interface Plugin {
    Storage createStorage(StorageConfig config);
    void cleanUp();
}
