package io.indexkit.collections.extendiblehash;

import java.io.IOException;

import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

/**
 * Encodes keys or values of an {@link ExtendibleHash} as msgpack. A key's encoding is also what the default
 * {@link SipKeyHasher} hashes, so it must be stable: equal keys must always produce identical bytes.
 */
public interface Serde<T> {
    void pack(MessagePacker packer, T value) throws IOException;

    T unpack(MessageUnpacker unpacker) throws IOException;
}
