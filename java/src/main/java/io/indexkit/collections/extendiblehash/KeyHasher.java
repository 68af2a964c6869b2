package io.indexkit.collections.extendiblehash;

/**
 * Maps a key to a 64-bit hash, read as unsigned. Directory slots are taken from the low-order bits, so for a persisted
 * table the function must give the same answer in every process.
 */
@FunctionalInterface
public interface KeyHasher<K> {
    long hash(K key);
}
