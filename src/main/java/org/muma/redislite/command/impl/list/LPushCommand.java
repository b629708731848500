package org.muma.redislite.command.impl.list;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisInteger;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * LPUSH key element [element ...]
 * 逐个头插：LPUSH list a b c 之后表头是 c
 */
public class LPushCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("lpush");
        return new RedisInteger(storage.lpush(arg(args, 1), argsFrom(args, 2)));
    }
}
