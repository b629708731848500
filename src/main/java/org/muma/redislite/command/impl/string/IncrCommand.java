package org.muma.redislite.command.impl.string;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisInteger;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * INCR key
 * Key 不存在时按 0 处理；原有 TTL 保留
 */
public class IncrCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("incr");
        return new RedisInteger(storage.incr(arg(args, 1)));
    }
}
