package com.keyhive.core;

import java.util.List;

/**
 * Indexes the query layer relies on. Backends ensure all of them before serving.
 */
public final class KeyIndexes {
    private KeyIndexes() {
    }

    public record IndexSpec(String field, boolean unique, boolean background) {}

    public static final List<IndexSpec> ALL = List.of(
            new IndexSpec(KeyRecord.RFINGERPRINT, true, false),
            new IndexSpec(KeyRecord.DIGEST, true, false),
            new IndexSpec(KeyRecord.MTIME, false, false),
            // membership search, built without blocking traffic
            new IndexSpec(KeyRecord.KEYWORDS, false, true));
}
