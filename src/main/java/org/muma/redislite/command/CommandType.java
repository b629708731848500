package org.muma.redislite.command;

import java.util.Locale;
import java.util.Optional;

/**
 * 支持的命令
 * <p>
 * write: 成功后需要转发给 Slave；blocking: 可能挂起调用线程，不计入慢命令日志。
 */
public enum CommandType {

    // server
    PING(false, false),
    ECHO(false, false),
    TYPE(false, false),
    INFO(false, false),

    // string
    GET(false, false),
    SET(true, false),
    INCR(true, false),

    // list
    RPUSH(true, false),
    LPUSH(true, false),
    LRANGE(false, false),
    LLEN(false, false),
    LPOP(true, false),
    RPOP(true, false),
    BLPOP(true, true),

    // stream
    XADD(true, false),
    XRANGE(false, false),
    XREAD(false, true),

    // transaction
    MULTI(false, false),
    EXEC(false, false),
    DISCARD(false, false),

    // replication
    REPLCONF(false, false),
    PSYNC(false, false);

    private final boolean write;
    private final boolean blocking;

    CommandType(boolean write, boolean blocking) {
        this.write = write;
        this.blocking = blocking;
    }

    public boolean isWrite() {
        return write;
    }

    public boolean isBlocking() {
        return blocking;
    }

    /**
     * 按名字查找，大小写不敏感
     */
    public static Optional<CommandType> lookup(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
