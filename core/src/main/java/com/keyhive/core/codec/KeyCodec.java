package com.keyhive.core.codec;

import com.keyhive.core.KeyDecodeException;
import com.keyhive.core.Pubkey;

import java.util.List;

/**
 * Binary encoding of key material.
 */
public interface KeyCodec {
    byte[] serialize(Pubkey key);

    /**
     * Content digest of serialized packets, as stored and used as the update token.
     * Must be deterministic, lowercase hex.
     */
    String digest(byte[] packets);

    /**
     * Decodes every key in {@code packets}, in stream order.
     *
     * @throws KeyDecodeException if the packets are malformed
     */
    List<Pubkey> parse(byte[] packets);
}
