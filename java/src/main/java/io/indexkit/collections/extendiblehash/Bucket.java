package io.indexkit.collections.extendiblehash;

import java.util.LinkedHashMap;
import java.util.Map;

// Every key in a bucket agrees with `pattern` on its `localDepth` low-order hash bits.
final class Bucket<K, V> {
    static final String BlobPrefix = "bucket-";

    final int id;
    final int capacity;
    int localDepth;
    int pattern;
    final LinkedHashMap<K, V> items = new LinkedHashMap<>();

    Bucket(int id, int capacity, int localDepth, int pattern) {
        this.id = id;
        this.capacity = capacity;
        this.localDepth = localDepth;
        this.pattern = pattern;
    }

    static String blobName(int id) {
        return BlobPrefix + id;
    }

    boolean contains(K key) {
        return items.containsKey(key);
    }

    V get(K key) {
        return items.get(key);
    }

    boolean isFull() {
        return items.size() >= capacity;
    }

    // fails on a duplicate or when the bucket is at capacity
    boolean insert(K key, V value) {
        if (items.containsKey(key) || isFull()) {
            return false;
        }
        items.put(key, value);
        return true;
    }

    // redistribution after a split; the caller guarantees the capacity
    void place(K key, V value) {
        items.put(key, value);
    }

    byte[] pack(Serde<K> keySerde, Serde<V> valueSerde) {
        final MsgPacker packer = new MsgPacker();
        packer.packMapHeader(3);
        packer.packString("LocalDepth");
        packer.packInt(localDepth);
        packer.packString("Pattern");
        packer.packInt(pattern);
        packer.packString("Items");
        packer.packArrayHeader(items.size() * 2);
        for (Map.Entry<K, V> entry : items.entrySet()) {
            packer.pack(keySerde, entry.getKey());
            packer.pack(valueSerde, entry.getValue());
        }
        return packer.toByteArray();
    }

    static <K, V> Bucket<K, V> unpack(int id, int capacity, byte[] data, Serde<K> keySerde, Serde<V> valueSerde) {
        final Bucket<K, V> b = new Bucket<>(id, capacity, -1, -1);
        try (final MsgUnpacker unpacker = new MsgUnpacker(data)) {
            int pairs = unpacker.unpackMapHeader();
            if (pairs != 3) {
                throw new IllegalArgumentException("Expected 3 pairs in bucket " + id + ". Found " + pairs);
            }
            for (; pairs > 0; pairs--) {
                final String key = unpacker.unpackString();
                switch (key) {
                    case "LocalDepth":
                        b.localDepth = unpacker.unpackInt();
                        break;
                    case "Pattern":
                        b.pattern = unpacker.unpackInt();
                        break;
                    case "Items":
                        {
                            final int n = unpacker.unpackArrayHeader();
                            if (n % 2 != 0) {
                                throw new IllegalArgumentException("odd item array length in bucket " + id);
                            }
                            for (int i = 0; i < n; i += 2) {
                                final K k = unpacker.unpack(keySerde);
                                b.items.put(k, unpacker.unpack(valueSerde));
                            }
                            break;
                        }
                    default:
                        throw new IllegalArgumentException("Unexpected key in bucket " + id + ": " + key);
                }
            }
        }
        if (b.localDepth < 0 || b.pattern < 0 || (b.localDepth < 31 && b.pattern >= (1 << b.localDepth))) {
            throw new IllegalArgumentException(
                    String.format("bucket %d has local depth %d and pattern %d", id, b.localDepth, b.pattern));
        }
        if (b.items.size() > capacity) {
            throw new IllegalArgumentException(
                    String.format("bucket %d holds %d items, capacity is %d", id, b.items.size(), capacity));
        }
        return b;
    }

    @Override
    public String toString() {
        return "[LocalDepth: " + localDepth + ", Items: " + items + "]";
    }
}
