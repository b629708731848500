package org.muma.redislite.command.impl.transaction;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

public class DiscardCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 1) return errorArgs("discard");
        if (context.closeTransaction() == null) {
            throw new RedisException("ERR DISCARD without MULTI");
        }
        return SimpleString.OK;
    }
}
