package org.muma.redislite.command.impl.list;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisInteger;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * RPUSH key element [element ...]
 */
public class RPushCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("rpush");
        return new RedisInteger(storage.rpush(arg(args, 1), argsFrom(args, 2)));
    }
}
