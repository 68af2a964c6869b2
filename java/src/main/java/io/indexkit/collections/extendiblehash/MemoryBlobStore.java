package io.indexkit.collections.extendiblehash;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public class MemoryBlobStore implements BlobStore {
    private final Map<String, byte[]> blobs = new HashMap<>();

    @Override
    public void put(String name, byte[] blob) {
        blobs.put(name, blob.clone());
    }

    @Override
    public byte[] get(String name) {
        final byte[] blob = blobs.get(name);
        return blob == null ? null : blob.clone();
    }

    public Set<String> names() {
        return new TreeSet<>(blobs.keySet());
    }
}
