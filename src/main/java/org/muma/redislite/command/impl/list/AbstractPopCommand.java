package org.muma.redislite.command.impl.list;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

import java.util.List;

/**
 * LPOP / RPOP key [count]
 * <p>
 * 不带 count：返回单个元素或 nil；带 count：返回数组，列表不存在时返回 nil 数组。
 */
public abstract class AbstractPopCommand implements RedisCommand {

    private final String name;

    protected AbstractPopCommand(String name) {
        this.name = name;
    }

    protected abstract List<String> pop(StorageEngine storage, String key, int count);

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 2 || args.size() > 3) return errorArgs(name);

        String key = arg(args, 1);
        if (args.size() == 2) {
            List<String> popped = pop(storage, key, 1);
            return popped == null || popped.isEmpty() ? BulkString.NULL : new BulkString(popped.get(0));
        }

        long count = parseLong(arg(args, 2));
        if (count < 0 || count > Integer.MAX_VALUE) {
            throw new RedisException("ERR value is out of range, must be positive");
        }
        List<String> popped = pop(storage, key, (int) count);
        return popped == null ? RedisArray.NULL : RedisArray.of(popped);
    }

    // 什么都没弹出就不需要转发
    @Override
    public RedisArray propagation(RedisArray args, RedisMessage reply) {
        if (reply instanceof BulkString bs && bs.isNull()) return null;
        if (reply instanceof RedisArray array && (array.isNull() || array.size() == 0)) return null;
        return args;
    }
}
