package io.indexkit.collections.extendiblehash;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ExtendibleHash is a map structure using the extendible-hashing algorithm. A directory of {@code 2^globalDepth}
 * slots is indexed by the low-order bits of each key's hash; several slots may share one bucket. When a bucket
 * overflows it is split in two, and the directory doubles first if the bucket already uses every directory bit.
 *
 * <p>Every bucket and the table metadata are written to a {@link BlobStore} as they change, msgpack encoded. Those
 * writes are best-effort: a failing store is logged and the in-memory table carries on. A table whose blobs were all
 * written can be reopened with {@link #open}.
 *
 * <p>Duplicate keys are rejected, never overwritten. Keys are hashed with {@link SipKeyHasher} unless another
 * {@link KeyHasher} is given. Not thread-safe.
 */
public class ExtendibleHash<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(ExtendibleHash.class);

    public static final int DEFAULT_BUCKET_CAPACITY = 2;
    public static final int DEFAULT_GLOBAL_DEPTH = 1;
    public static final int MAX_INSERT_ATTEMPTS = 10;

    private final BlobStore store;
    private final Serde<K> keySerde;
    private final Serde<V> valueSerde;
    private final KeyHasher<K> hasher;
    private final Metadata meta;
    private Bucket<K, V>[] directory;
    private int size;

    private ExtendibleHash(
            BlobStore store,
            Serde<K> keySerde,
            Serde<V> valueSerde,
            KeyHasher<K> hasher,
            Metadata meta,
            Bucket<K, V>[] directory) {
        this.store = store;
        this.keySerde = keySerde;
        this.valueSerde = valueSerde;
        this.hasher = hasher;
        this.meta = meta;
        this.directory = directory;
        for (Bucket<K, V> b : distinctBuckets()) {
            size += b.items.size();
        }
    }

    /**
     * Create a brand new empty table with the default bucket capacity and global depth, hashing keys with
     * {@link SipKeyHasher} and keeping its blobs in memory.
     */
    public static <K, V> ExtendibleHash<K, V> createEmpty(Serde<K> keySerde, Serde<V> valueSerde) {
        return createEmpty(
                new MemoryBlobStore(),
                keySerde,
                valueSerde,
                new SipKeyHasher<>(keySerde),
                DEFAULT_BUCKET_CAPACITY,
                DEFAULT_GLOBAL_DEPTH);
    }

    /**
     * Create a brand new empty table. A single bucket is created and every directory slot refers to it; its local
     * depth is 0 since it accepts every hash. Its first split therefore raises it to depth 1 without growing the
     * directory, and a directory of {@code 2^g} slots only grows once a bucket at depth {@code g} overflows. The metadata and that bucket are written to {@code store} straight away,
     * replacing whatever table the store held before.
     *
     * @param bucketCapacity the number of items a bucket holds before it must split
     * @param globalDepth    the initial number of hash bits used to index the directory
     */
    public static <K, V> ExtendibleHash<K, V> createEmpty(
            BlobStore store,
            Serde<K> keySerde,
            Serde<V> valueSerde,
            KeyHasher<K> hasher,
            int bucketCapacity,
            int globalDepth) {
        if (bucketCapacity < 1) {
            throw new IllegalArgumentException("bucket capacity must be positive, got " + bucketCapacity);
        }
        if (globalDepth < 0 || globalDepth > Metadata.MaxGlobalDepth) {
            throw new IllegalArgumentException(
                    "global depth must be between 0 and " + Metadata.MaxGlobalDepth + ", got " + globalDepth);
        }
        final Metadata meta = new Metadata(globalDepth, bucketCapacity);
        final Bucket<K, V> initial = new Bucket<>(meta.nextBucketId++, bucketCapacity, 0, 0);
        final Bucket<K, V>[] directory = newDirectory(meta.directorySize());
        Arrays.fill(directory, initial);
        final ExtendibleHash<K, V> eh = new ExtendibleHash<>(
                Objects.requireNonNull(store, "store"),
                Objects.requireNonNull(keySerde, "keySerde"),
                Objects.requireNonNull(valueSerde, "valueSerde"),
                Objects.requireNonNull(hasher, "hasher"),
                meta,
                directory);
        eh.saveMetadata();
        eh.save(initial);
        return eh;
    }

    /**
     * Regain access to a table previously written to {@code store}. The directory is rebuilt from each bucket's local
     * depth and bit pattern. If the store holds no table, a new one is created with the given capacity and depth;
     * otherwise the stored capacity and depth win, and a differing request is logged.
     *
     * @throws CorruptTableException if the metadata or any bucket is missing, unreadable or inconsistent, or if a
     *     stored key does not hash to its bucket under {@code hasher}
     */
    public static <K, V> ExtendibleHash<K, V> open(
            BlobStore store,
            Serde<K> keySerde,
            Serde<V> valueSerde,
            KeyHasher<K> hasher,
            int bucketCapacity,
            int globalDepth) throws IOException {
        final byte[] metaBlob = store.get(Metadata.BlobName);
        if (metaBlob == null) {
            logger.info("No table found in store, creating an empty one");
            return createEmpty(store, keySerde, valueSerde, hasher, bucketCapacity, globalDepth);
        }
        final Metadata meta;
        try {
            meta = new Metadata(metaBlob);
        } catch (IllegalArgumentException | MsgPackException e) {
            throw new CorruptTableException("unreadable table metadata", e);
        }
        if (meta.bucketCapacity != bucketCapacity) {
            logger.warn("Ignoring bucket capacity {}, the stored table uses {}", bucketCapacity, meta.bucketCapacity);
        }
        if (meta.globalDepth < globalDepth) {
            logger.warn("Ignoring global depth {}, the stored table is at depth {}", globalDepth, meta.globalDepth);
        }
        final Bucket<K, V>[] directory = newDirectory(meta.directorySize());
        for (int id = 0; id < meta.nextBucketId; id++) {
            final byte[] blob = store.get(Bucket.blobName(id));
            if (blob == null) {
                throw new CorruptTableException("bucket " + id + " is missing");
            }
            final Bucket<K, V> b;
            try {
                b = Bucket.unpack(id, meta.bucketCapacity, blob, keySerde, valueSerde);
            } catch (IllegalArgumentException | MsgPackException e) {
                throw new CorruptTableException("bucket " + id + " is unreadable", e);
            }
            if (b.localDepth > meta.globalDepth) {
                throw new CorruptTableException(
                        String.format(
                                "bucket %d has local depth %d, global depth is %d", id, b.localDepth, meta.globalDepth));
            }
            final long bucketMask = (1L << b.localDepth) - 1;
            for (K key : b.items.keySet()) {
                if ((hasher.hash(key) & bucketMask) != b.pattern) {
                    throw new CorruptTableException(
                            String.format("key %s in bucket %d does not hash to its pattern %d", key, id, b.pattern));
                }
            }
            final int stride = 1 << b.localDepth;
            for (int i = b.pattern; i < directory.length; i += stride) {
                if (directory[i] != null) {
                    throw new CorruptTableException(
                            String.format("slot %d is claimed by buckets %d and %d", i, directory[i].id, id));
                }
                directory[i] = b;
            }
        }
        for (int i = 0; i < directory.length; i++) {
            if (directory[i] == null) {
                throw new CorruptTableException("slot " + i + " has no bucket");
            }
        }
        final ExtendibleHash<K, V> eh = new ExtendibleHash<>(store, keySerde, valueSerde, hasher, meta, directory);
        logger.info(
                "Opened table with global depth {}, {} buckets and {} items", meta.globalDepth, eh.bucketCount(), eh.size);
        return eh;
    }

    @SuppressWarnings("unchecked")
    private static <K, V> Bucket<K, V>[] newDirectory(int n) {
        return (Bucket<K, V>[]) new Bucket<?, ?>[n];
    }

    public long hash(K key) {
        return hasher.hash(key);
    }

    /** The directory slot for {@code key}: the low-order {@code globalDepth} bits of its hash. */
    public int directoryIndex(K key) {
        return (int) (hasher.hash(key) & meta.mask());
    }

    /**
     * Search the table for the given key.
     *
     * @return The corresponding value if the key is found; null otherwise.
     */
    public V search(K key) {
        Objects.requireNonNull(key, "key");
        return directory[directoryIndex(key)].get(key);
    }

    /**
     * Add the given key and value to the table, splitting the target bucket (and growing the directory) as often as it
     * takes for the key to fit, up to {@link #MAX_INSERT_ATTEMPTS} times.
     *
     * @return true if the pair was added; false if the key was already present or no room could be made for it
     */
    public boolean insert(K key, V value) {
        Objects.requireNonNull(key, "key");
        for (int attempt = 0; attempt < MAX_INSERT_ATTEMPTS; attempt++) {
            final int index = directoryIndex(key);
            final Bucket<K, V> bucket = directory[index];
            if (bucket.contains(key)) {
                return false;
            }
            if (bucket.insert(key, value)) {
                size++;
                save(bucket);
                return true;
            }
            if (!splitBucket(index)) {
                break;
            }
        }
        logger.warn("Could not make room for key {} in {} attempts", key, MAX_INSERT_ATTEMPTS);
        return false;
    }

    // false if the bucket cannot be split because the directory is at its maximum depth
    boolean splitBucket(int index) {
        final Bucket<K, V> old = directory[index];
        if (old.localDepth == meta.globalDepth) {
            if (meta.globalDepth >= Metadata.MaxGlobalDepth) {
                logger.warn("Bucket {} is full and the directory is already at depth {}", old.id, meta.globalDepth);
                return false;
            }
            growDirectory();
        }
        old.localDepth++;
        final int bit = 1 << (old.localDepth - 1);
        final Bucket<K, V> sibling = new Bucket<>(meta.nextBucketId++, meta.bucketCapacity, old.localDepth, old.pattern | bit);
        for (int i = 0; i < directory.length; i++) {
            if (directory[i] == old && (i & bit) != 0) {
                directory[i] = sibling;
            }
        }

        final List<Map.Entry<K, V>> redistribute = new ArrayList<>(old.items.entrySet());
        old.items.clear();
        for (Map.Entry<K, V> entry : redistribute) {
            directory[directoryIndex(entry.getKey())].place(entry.getKey(), entry.getValue());
        }
        logger.debug(
                "Split bucket {} into buckets {} ({} items) and {} ({} items) at local depth {}",
                old.id, old.id, old.items.size(), sibling.id, sibling.items.size(), old.localDepth);

        save(old);
        save(sibling);
        saveMetadata();
        return true;
    }

    // slot i + oldSize starts out referring to the same bucket as slot i
    void growDirectory() {
        final int oldSize = directory.length;
        directory = Arrays.copyOf(directory, oldSize * 2);
        System.arraycopy(directory, 0, directory, oldSize, oldSize);
        meta.globalDepth++;
        logger.debug("Directory grew to {} slots, global depth {}", directory.length, meta.globalDepth);
        saveMetadata();
    }

    private void save(Bucket<K, V> b) {
        write(Bucket.blobName(b.id), b.pack(keySerde, valueSerde));
    }

    private void saveMetadata() {
        write(Metadata.BlobName, meta.pack());
    }

    private void write(String name, byte[] blob) {
        try {
            store.put(name, blob);
        } catch (IOException e) {
            logger.warn("Failed to persist {}, carrying on in memory only", name, e);
        }
    }

    /** Returns the number of entries in the table. */
    public int size() {
        return size;
    }

    /** Returns the number of distinct buckets the directory refers to. */
    public int bucketCount() {
        return distinctBuckets().size();
    }

    public int globalDepth() {
        return meta.globalDepth;
    }

    public int directorySize() {
        return directory.length;
    }

    public int bucketCapacity() {
        return meta.bucketCapacity;
    }

    public int localDepth(int slot) {
        return directory[slot].localDepth;
    }

    public int bucketId(int slot) {
        return directory[slot].id;
    }

    /** A read-only view of the bucket the given slot refers to. */
    public Map<K, V> bucketContents(int slot) {
        return Collections.unmodifiableMap(directory[slot].items);
    }

    /** Visits every entry once, bucket by bucket in bucket id order. */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        for (Bucket<K, V> b : distinctBuckets()) {
            b.items.forEach(action);
        }
    }

    private List<Bucket<K, V>> distinctBuckets() {
        final TreeMap<Integer, Bucket<K, V>> byId = new TreeMap<>();
        for (Bucket<K, V> b : directory) {
            byId.putIfAbsent(b.id, b);
        }
        return new ArrayList<>(byId.values());
    }

    /** Renders the directory and every bucket's contents. Meant for people, not parsers. */
    public String visualize() {
        final StringBuilder b = new StringBuilder();
        final String rule = String.join("", Collections.nCopies(50, "-"));
        b.append("Global Depth: ").append(meta.globalDepth).append('\n');
        b.append("\nDirectory Structure:\n").append(rule).append('\n');
        for (int i = 0; i < directory.length; i++) {
            b.append("Dir[").append(i).append("] -> Bucket-").append(directory[i].id).append('\n');
        }
        b.append("\nBucket Contents:\n").append(rule).append('\n');
        for (Bucket<K, V> bucket : distinctBuckets()) {
            b.append("Bucket-").append(bucket.id).append(" (Local Depth: ").append(bucket.localDepth).append("):\n");
            if (bucket.items.isEmpty()) {
                b.append("  Empty\n");
            }
            for (Map.Entry<K, V> entry : bucket.items.entrySet()) {
                b.append("  Key: ").append(entry.getKey()).append(", Value: ").append(entry.getValue()).append('\n');
            }
        }
        return b.toString();
    }

    public void checkInvariants() {
        if (directory.length != meta.directorySize()) {
            throw new IllegalStateException(
                    String.format("directory has %d slots, global depth is %d", directory.length, meta.globalDepth));
        }
        final Map<Bucket<K, V>, Integer> slotCounts = new LinkedHashMap<>();
        for (int i = 0; i < directory.length; i++) {
            final Bucket<K, V> b = directory[i];
            if (b.localDepth > meta.globalDepth) {
                throw new IllegalStateException("bucket " + b.id + " is deeper than the directory");
            }
            if ((i & ((1 << b.localDepth) - 1)) != b.pattern) {
                throw new IllegalStateException("slot " + i + " does not match the pattern of bucket " + b.id);
            }
            slotCounts.merge(b, 1, Integer::sum);
        }
        int items = 0;
        for (Map.Entry<Bucket<K, V>, Integer> entry : slotCounts.entrySet()) {
            final Bucket<K, V> b = entry.getKey();
            final int expected = 1 << (meta.globalDepth - b.localDepth);
            if (entry.getValue() != expected) {
                throw new IllegalStateException(
                        String.format(
                                "bucket %d at local depth %d is referenced by %d slots, expected %d",
                                b.id, b.localDepth, entry.getValue(), expected));
            }
            if (b.items.size() > b.capacity) {
                throw new IllegalStateException("bucket " + b.id + " is over capacity");
            }
            for (K key : b.items.keySet()) {
                if (directory[directoryIndex(key)] != b) {
                    throw new IllegalStateException("key " + key + " is stored in the wrong bucket " + b.id);
                }
            }
            items += b.items.size();
        }
        if (items != size) {
            throw new IllegalStateException("table holds " + items + " items but counts " + size);
        }
    }
}
