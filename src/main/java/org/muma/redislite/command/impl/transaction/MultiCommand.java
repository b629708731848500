package org.muma.redislite.command.impl.transaction;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

public class MultiCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 1) return errorArgs("multi");
        if (context.isInTransaction()) {
            throw new RedisException("ERR MULTI calls can not be nested");
        }
        context.beginTransaction();
        return SimpleString.OK;
    }
}
