package org.muma.redislite.command.impl.server;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

public class EchoCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("echo");
        return new BulkString(arg(args, 1));
    }
}
