package com.keyhive.core.codec;

import com.keyhive.core.KeyDecodeException;
import com.keyhive.core.Pubkey;
import org.bouncycastle.crypto.digests.MD5Digest;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.bc.BcPGPObjectFactory;
import org.bouncycastle.util.encoders.Hex;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link KeyCodec} over binary OpenPGP transferable public keys, using BouncyCastle.
 */
public class OpenPgpCodec implements KeyCodec {

    @Override
    public byte[] serialize(Pubkey key) {
        return encode(key.ring());
    }

    @Override
    public String digest(byte[] packets) {
        return md5Hex(packets);
    }

    @Override
    public List<Pubkey> parse(byte[] packets) {
        List<Pubkey> result = new ArrayList<>();
        try {
            BcPGPObjectFactory factory = new BcPGPObjectFactory(packets);
            Object next;
            while ((next = factory.nextObject()) != null) {
                if (!(next instanceof PGPPublicKeyRing)) {
                    throw new KeyDecodeException("Unexpected " + next.getClass().getSimpleName() + " in key material");
                }
                result.add(Pubkey.of((PGPPublicKeyRing) next));
            }
        } catch (IOException e) {
            throw new KeyDecodeException("Malformed key material: " + e.getMessage(), e);
        } catch (KeyDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            // BouncyCastle reports some truncated packets this way
            throw new KeyDecodeException("Malformed key material: " + e.getMessage(), e);
        }
        return result;
    }

    public static byte[] encode(PGPPublicKeyRing ring) {
        try {
            return ring.getEncoded();
        } catch (IOException e) {
            throw new KeyDecodeException("Failed to encode key " + Hex.toHexString(ring.getPublicKey().getFingerprint()), e);
        }
    }

    /**
     * Lowercase hex MD5 of {@code packets}.
     */
    public static String md5Hex(byte[] packets) {
        MD5Digest md5 = new MD5Digest();
        md5.update(packets, 0, packets.length);
        byte[] out = new byte[md5.getDigestSize()];
        md5.doFinal(out, 0);
        return Hex.toHexString(out);
    }
}
