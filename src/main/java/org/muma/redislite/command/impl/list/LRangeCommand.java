package org.muma.redislite.command.impl.list;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * LRANGE key start stop
 * 支持负数下标；越界部分被截断，区间为空返回空数组
 */
public class LRangeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 4) return errorArgs("lrange");

        long start = parseLong(arg(args, 2));
        long stop = parseLong(arg(args, 3));
        return RedisArray.of(storage.lrange(arg(args, 1), start, stop));
    }
}
