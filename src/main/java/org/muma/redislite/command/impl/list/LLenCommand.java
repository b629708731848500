package org.muma.redislite.command.impl.list;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisInteger;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

public class LLenCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("llen");
        return new RedisInteger(storage.llen(arg(args, 1)));
    }
}
