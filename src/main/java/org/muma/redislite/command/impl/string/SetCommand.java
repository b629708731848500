package org.muma.redislite.command.impl.string;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.SetOptions;
import org.muma.redislite.store.StorageEngine;

import java.util.Locale;

/**
 * SET key value [NX|XX] [GET] [EX seconds|PX milliseconds|EXAT unix-time-seconds|PXAT unix-time-milliseconds|KEEPTTL]
 * <p>
 * 过期参数最多出现一个。NX/XX 条件不满足时由存储引擎报错。
 */
public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("set");

        String key = arg(args, 1);
        String value = arg(args, 2);

        // --- 1. 参数解析阶段 ---
        boolean nx = false;
        boolean xx = false;
        boolean get = false;
        SetOptions.Ttl ttl = null;

        for (int i = 3; i < args.size(); i++) {
            String opt = arg(args, i).toUpperCase(Locale.ROOT);
            switch (opt) {
                case "NX" -> nx = true;
                case "XX" -> xx = true;
                case "GET" -> get = true;
                case "KEEPTTL" -> {
                    if (ttl != null) throw RedisException.syntax();
                    ttl = SetOptions.Ttl.KEEP;
                }
                case "EX", "PX", "EXAT", "PXAT" -> {
                    if (ttl != null || i + 1 >= args.size()) throw RedisException.syntax();
                    long amount = parseLong(arg(args, ++i));
                    if (amount <= 0) {
                        throw invalidExpireTime();
                    }
                    ttl = new SetOptions.Ttl(SetOptions.TtlKind.valueOf(opt), amount);
                }
                default -> throw RedisException.syntax();
            }
        }

        // --- 2. 写入阶段 ---
        String previous;
        try {
            previous = storage.set(key, value, new SetOptions(xx, nx, ttl));
        } catch (ArithmeticException e) {
            throw invalidExpireTime();
        }

        if (get) {
            return previous == null ? BulkString.NULL : new BulkString(previous);
        }
        return SimpleString.OK;
    }

    private static RedisException invalidExpireTime() {
        return new RedisException("ERR invalid expire time in 'set' command");
    }
}
