package io.indexkit.collections.extendiblehash;

public class MsgPackException extends RuntimeException {
    public MsgPackException(Throwable cause) {
        super(cause);
    }

    public MsgPackException(String message) {
        super(message);
    }
}
