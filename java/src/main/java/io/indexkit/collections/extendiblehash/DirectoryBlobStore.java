package io.indexkit.collections.extendiblehash;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Stores each blob as a file {@code <name>.msgpack} in one directory, created on first write. */
public class DirectoryBlobStore implements BlobStore {
    static final String Suffix = ".msgpack";

    private final Path directory;

    public DirectoryBlobStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void put(String name, byte[] blob) throws IOException {
        Files.createDirectories(directory);
        Files.write(file(name), blob);
    }

    @Override
    public byte[] get(String name) throws IOException {
        final Path file = file(name);
        if (!Files.exists(file)) {
            return null;
        }
        return Files.readAllBytes(file);
    }

    private Path file(String name) {
        if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            throw new IllegalArgumentException("not a valid blob name: '" + name + "'");
        }
        return directory.resolve(name + Suffix);
    }
}
