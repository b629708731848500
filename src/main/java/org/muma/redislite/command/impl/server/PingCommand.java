package org.muma.redislite.command.impl.server;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * PING [message]
 */
public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return switch (args.size()) {
            case 1 -> PONG;
            case 2 -> new BulkString(arg(args, 1));
            default -> errorArgs("ping");
        };
    }
}
