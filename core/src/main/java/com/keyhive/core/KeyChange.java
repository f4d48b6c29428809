package com.keyhive.core;

/**
 * A completed mutation of the key store, delivered to subscribers of a {@link Storage}.
 */
public interface KeyChange {
    String rfingerprint();
}
