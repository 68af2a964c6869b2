package io.indexkit.collections.extendiblehash;

import java.io.IOException;

/**
 * A flat namespace of named byte blobs. {@link ExtendibleHash} keeps its metadata and each bucket in a blob of its own.
 * Writes need not be atomic or durable.
 */
public interface BlobStore {
    void put(String name, byte[] blob) throws IOException;

    /**
     * @return the blob last stored under {@code name}, or null if there is none
     */
    byte[] get(String name) throws IOException;
}
