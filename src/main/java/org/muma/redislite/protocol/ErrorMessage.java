package org.muma.redislite.protocol;

// 2. 错误 (-)
public record ErrorMessage(String content) implements RedisMessage {
}
