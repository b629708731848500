package org.muma.redislite.protocol;

/**
 * FULLRESYNC 之后 Master 推送的快照数据: $<len>\r\n<payload>
 * 注意它末尾没有 CRLF，所以不是一个普通的 BulkString。
 */
public record RdbSnapshot(byte[] content) {
}
