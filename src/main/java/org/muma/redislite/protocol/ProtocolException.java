package org.muma.redislite.protocol;

/**
 * 报文格式错误 (非法类型字节、长度无法解析、缺少 CRLF 等)
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }
}
