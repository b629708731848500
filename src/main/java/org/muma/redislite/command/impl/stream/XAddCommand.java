package org.muma.redislite.command.impl.stream;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.common.StreamId;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * XADD key id field value [field value ...]
 * <p>
 * id 可以是 "*"、"T-*" 或显式的 "T-S"。
 * 复制时把 id 换成实际生成的值，Slave 不会自己再生成一次。
 */
public class XAddCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 5 || (args.size() - 3) % 2 != 0) return errorArgs("xadd");

        StreamId id = storage.xadd(arg(args, 1), arg(args, 2), argsFrom(args, 3));
        return new BulkString(id.toString());
    }

    @Override
    public RedisArray propagation(RedisArray args, RedisMessage reply) {
        RedisMessage[] effective = args.elements().clone();
        effective[2] = reply;
        return new RedisArray(effective);
    }
}
