package com.keyhive.core;

import java.time.Instant;

public record Keyring(
        Pubkey pubkey,
        Instant createdAt,
        Instant modifiedAt
) {}
