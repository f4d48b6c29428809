package com.keyhive.core.codec;

import com.keyhive.core.KeyDecodeException;
import com.keyhive.core.Pubkey;
import com.keyhive.core.TestKeys;
import org.bouncycastle.openpgp.PGPKeyPair;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OpenPgpCodecTest {
    private final OpenPgpCodec codec = new OpenPgpCodec();

    @Test
    public void parseShouldReturnEveryKeyInStreamOrder() {
        Pubkey alice = TestKeys.pubkey("Alice <alice@example.com>");
        Pubkey bob = TestKeys.pubkey("Bob <bob@example.com>");
        byte[] a = codec.serialize(alice);
        byte[] b = codec.serialize(bob);
        byte[] both = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, both, a.length, b.length);

        List<Pubkey> keys = codec.parse(both);

        assertEquals(2, keys.size());
        assertEquals(alice.fingerprint(), keys.get(0).fingerprint());
        assertEquals(bob.fingerprint(), keys.get(1).fingerprint());
    }

    @Test
    public void parseShouldRejectGarbage() {
        byte[] garbage = "definitely not a key".getBytes(StandardCharsets.US_ASCII);

        assertThrows(KeyDecodeException.class, () -> codec.parse(garbage));
    }

    @Test
    public void parseOfNothingShouldBeEmpty() {
        assertTrue(codec.parse(new byte[0]).isEmpty());
    }

    @Test
    public void digestShouldTrackContent() {
        PGPKeyPair pair = TestKeys.keyPair();
        Pubkey first = TestKeys.pubkey(pair, "Erin <erin@example.com>");
        Pubkey second = TestKeys.pubkey(pair, "Erin <erin@example.org>");

        assertEquals(first.fingerprint(), second.fingerprint());
        assertNotEquals(first.digest(), second.digest());
        assertEquals(32, first.digest().length());
        assertEquals(first.digest(), codec.digest(codec.serialize(first)));
    }
}
