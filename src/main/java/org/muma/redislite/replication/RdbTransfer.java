package org.muma.redislite.replication;

import java.nio.charset.StandardCharsets;

/**
 * FULLRESYNC 之后发送的快照帧: $<len>\r\n + payload (不带结尾 CRLF)
 */
public record RdbTransfer(byte[] header, byte[] payload) {

    public static RdbTransfer of(byte[] payload) {
        byte[] header = ("$" + payload.length + "\r\n").getBytes(StandardCharsets.UTF_8);
        return new RdbTransfer(header, payload);
    }

    public byte[] toBytes() {
        byte[] bytes = new byte[header.length + payload.length];
        System.arraycopy(header, 0, bytes, 0, header.length);
        System.arraycopy(payload, 0, bytes, header.length, payload.length);
        return bytes;
    }
}
