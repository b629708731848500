package org.muma.redislite.protocol;

// 1. 简单字符串 (+)
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString QUEUED = new SimpleString("QUEUED");
}
