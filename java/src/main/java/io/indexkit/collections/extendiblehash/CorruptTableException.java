package io.indexkit.collections.extendiblehash;

import java.io.IOException;

/** Thrown when the blobs of a persisted {@link ExtendibleHash} do not describe a consistent table. */
public class CorruptTableException extends IOException {
    public CorruptTableException(String message) {
        super(message);
    }

    public CorruptTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
