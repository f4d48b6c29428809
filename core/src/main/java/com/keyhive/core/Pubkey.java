package com.keyhive.core;

import com.keyhive.core.codec.OpenPgpCodec;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * An OpenPGP public keyring together with the identifiers the store indexes it by.
 *
 * @param ring        the keyring as parsed by BouncyCastle
 * @param fingerprint lowercase hex fingerprint of the primary key
 * @param digest      lowercase hex MD5 of the keyring as {@link OpenPgpCodec} serializes it
 * @param userIds     user id strings of the primary key, decoded as UTF-8
 */
public record Pubkey(
        PGPPublicKeyRing ring,
        String fingerprint,
        String digest,
        List<String> userIds
) {
    public static Pubkey of(PGPPublicKeyRing ring) {
        PGPPublicKey primary = ring.getPublicKey();
        String fingerprint = Hex.toHexString(primary.getFingerprint());
        String digest = OpenPgpCodec.md5Hex(OpenPgpCodec.encode(ring));

        List<String> userIds = new ArrayList<>();
        Iterator<byte[]> raw = primary.getRawUserIDs();
        while (raw.hasNext()) {
            // malformed sequences become U+FFFD
            userIds.add(new String(raw.next(), StandardCharsets.UTF_8));
        }
        return new Pubkey(ring, fingerprint, digest, List.copyOf(userIds));
    }

    /**
     * The fingerprint reversed character by character. Key ids are suffixes of the
     * fingerprint, so reversed key ids are prefixes of this value.
     */
    public String rfingerprint() {
        return Fingerprints.reverse(fingerprint);
    }

    public String keyId() {
        return fingerprint.substring(Math.max(0, fingerprint.length() - 16));
    }
}
