package io.indexkit.collections.extendiblehash;

import java.io.IOException;

import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;

// convenience wrapper for MessageUnpacker without all the checked exceptions
class MsgUnpacker implements AutoCloseable {
    private final MessageUnpacker unpacker;

    MsgUnpacker(byte[] data) {
        this.unpacker = MessagePack.newDefaultUnpacker(data);
    }

    int unpackMapHeader() {
        try {
            final MessageFormat f = unpacker.getNextFormat();
            if (!(f == MessageFormat.FIXMAP || f == MessageFormat.MAP16 || f == MessageFormat.MAP32)) {
                throw new IllegalArgumentException("expected a map, found " + f);
            }
            return unpacker.unpackMapHeader();
        } catch (IOException | MessagePackException e) {
            throw new MsgPackException(e);
        }
    }

    int unpackArrayHeader() {
        try {
            return unpacker.unpackArrayHeader();
        } catch (IOException | MessagePackException e) {
            throw new MsgPackException(e);
        }
    }

    String unpackString() {
        try {
            return unpacker.unpackString();
        } catch (IOException | MessagePackException e) {
            throw new MsgPackException(e);
        }
    }

    int unpackInt() {
        try {
            return unpacker.unpackInt();
        } catch (IOException | MessagePackException e) {
            throw new MsgPackException(e);
        }
    }

    <T> T unpack(Serde<T> serde) {
        try {
            return serde.unpack(unpacker);
        } catch (IOException | MessagePackException e) {
            throw new MsgPackException(e);
        }
    }

    boolean hasNext() {
        try {
            return unpacker.hasNext();
        } catch (IOException | MessagePackException e) {
            throw new MsgPackException(e);
        }
    }

    @Override
    public void close() {
        try {
            unpacker.close();
        } catch (IOException | MessagePackException e) {
            throw new MsgPackException(e);
        }
    }
}
