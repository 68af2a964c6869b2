package io.indexkit.collections.extendiblehash;

import com.zackehh.siphash.SipHash;

import java.math.BigInteger;

/**
 * SipHash-2-4 of the key's msgpack encoding. The default hash key is the fixed 128-bit key {@code 00 01 02 .. 0f}
 * used by the SipHash reference test vectors, so hashes are reproducible across processes and platforms.
 */
public final class SipKeyHasher<K> implements KeyHasher<K> {
    static final int SipHashKeyLength = 16;
    static final byte[] DefaultHashKey = defaultHashKey();

    private final Serde<K> serde;
    private final SipHash sipHash;

    public SipKeyHasher(Serde<K> serde) {
        this(serde, DefaultHashKey);
    }

    public SipKeyHasher(Serde<K> serde, byte[] hashKey) {
        if (hashKey.length != SipHashKeyLength) {
            throw new IllegalArgumentException("SipHash keys are " + SipHashKeyLength + " bytes, got " + hashKey.length);
        }
        this.serde = serde;
        this.sipHash = new SipHash(hashKey.clone());
    }

    private static byte[] defaultHashKey() {
        final byte[] key = new byte[SipHashKeyLength];
        for (int i = 0; i < key.length; i++) {
            key[i] = (byte) i;
        }
        return key;
    }

    @Override
    public long hash(K key) {
        final MsgPacker packer = new MsgPacker();
        packer.pack(serde, key);
        return new BigInteger(sipHash.hash(packer.toByteArray()).getHex(), 16).longValue();
    }
}
