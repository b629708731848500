package org.muma.redislite.command.impl.list;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.PoppedItem;
import org.muma.redislite.store.StorageEngine;

import java.util.List;

/**
 * BLPOP key [key ...] timeout
 * <p>
 * 阻塞式左弹出。所有候选列表都为空时，当前连接的工作线程挂起，直到有数据推入或超时。
 * timeout 单位为秒 (可以是小数)，0 表示无限等待；超时返回 nil 数组。
 * 复制策略：不转发 BLPOP 本身，而是转发等价的 LPOP。
 */
public class BLPopCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("blpop");

        List<String> keys = argsFrom(args, 1).subList(0, args.size() - 2);

        double timeout;
        try {
            timeout = Double.parseDouble(arg(args, args.size() - 1));
        } catch (NumberFormatException e) {
            throw new RedisException("ERR timeout is not a float or out of range");
        }
        if (timeout < 0) {
            throw new RedisException("ERR timeout is negative");
        }
        if (Double.isNaN(timeout) || Double.isInfinite(timeout)) {
            throw new RedisException("ERR timeout is not a float or out of range");
        }

        PoppedItem item = storage.blpop(keys, context.getClientId(), timeout);
        if (item == null) {
            return RedisArray.NULL;
        }
        return RedisArray.of(item.list(), item.value());
    }

    @Override
    public RedisArray propagation(RedisArray args, RedisMessage reply) {
        if (!(reply instanceof RedisArray array) || array.isNull()) {
            return null;
        }
        String list = ((BulkString) array.elements()[0]).asString();
        return RedisArray.of("LPOP", list);
    }
}
