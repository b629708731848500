package org.muma.redislite.exception;

/**
 * 命令级错误的基类
 * <p>
 * message 就是回复给客户端的完整错误文本 (带 ERR / WRONGTYPE 前缀)，
 * CommandDispatcher 捕获后原样包装成 ErrorMessage。
 */
public class RedisException extends RuntimeException {

    public RedisException(String message) {
        super(message);
    }

    public static RedisException syntax() {
        return new RedisException("ERR syntax error");
    }

    public static RedisException wrongArgs(String command) {
        return new RedisException("ERR wrong number of arguments for '" + command.toLowerCase() + "' command");
    }

    public static RedisException notInteger() {
        return new RedisException("ERR value is not an integer or out of range");
    }
}
