package org.muma.redislite.exception;

public class StreamIdException extends RedisException {

    public static final String NOT_GREATER_THAN_ZERO = "ERR The ID specified in XADD must be greater than 0-0";
    public static final String NOT_GREATER_THAN_TOP =
            "ERR The ID specified in XADD is equal or smaller than the target stream top item";
    public static final String INVALID = "ERR Invalid stream ID specified as stream command argument";

    public StreamIdException(String message) {
        super(message);
    }
}
