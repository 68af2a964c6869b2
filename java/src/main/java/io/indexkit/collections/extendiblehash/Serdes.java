package io.indexkit.collections.extendiblehash;

import java.io.IOException;

import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

public final class Serdes {
    public static final Serde<Long> LONG = new Serde<Long>() {
        @Override
        public void pack(MessagePacker packer, Long value) throws IOException {
            packer.packLong(value);
        }

        @Override
        public Long unpack(MessageUnpacker unpacker) throws IOException {
            return unpacker.unpackLong();
        }
    };

    public static final Serde<Integer> INTEGER = new Serde<Integer>() {
        @Override
        public void pack(MessagePacker packer, Integer value) throws IOException {
            packer.packInt(value);
        }

        @Override
        public Integer unpack(MessageUnpacker unpacker) throws IOException {
            return unpacker.unpackInt();
        }
    };

    public static final Serde<String> STRING = new Serde<String>() {
        @Override
        public void pack(MessagePacker packer, String value) throws IOException {
            packer.packString(value);
        }

        @Override
        public String unpack(MessageUnpacker unpacker) throws IOException {
            return unpacker.unpackString();
        }
    };

    private Serdes() {
    }
}
