package com.keyhive.core;

public record KeyReplaced(
        String rfingerprint,
        String oldDigest,
        String newDigest
) implements KeyChange {}
