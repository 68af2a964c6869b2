package io.indexkit.collections.extendiblehash;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;

import java.io.IOException;

// convenience wrapper for MessageBufferPacker without all the checked exceptions
class MsgPacker {
    private final MessageBufferPacker packer;

    MsgPacker() {
        this.packer = MessagePack.newDefaultBufferPacker();
    }

    void packMapHeader(int n) {
        try {
            packer.packMapHeader(n);
        } catch (IOException e) {
            throw new MsgPackException(e);
        }
    }

    void packArrayHeader(int n) {
        try {
            packer.packArrayHeader(n);
        } catch (IOException e) {
            throw new MsgPackException(e);
        }
    }

    void packString(String s) {
        try {
            packer.packString(s);
        } catch (IOException e) {
            throw new MsgPackException(e);
        }
    }

    void packInt(int i) {
        try {
            packer.packInt(i);
        } catch (IOException e) {
            throw new MsgPackException(e);
        }
    }

    <T> void pack(Serde<T> serde, T value) {
        try {
            serde.pack(packer, value);
        } catch (IOException e) {
            throw new MsgPackException(e);
        }
    }

    byte[] toByteArray() {
        return packer.toByteArray();
    }
}
