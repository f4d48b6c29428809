package com.keyhive.core;

public record KeyAdded(
        String rfingerprint,
        String digest
) implements KeyChange {}
