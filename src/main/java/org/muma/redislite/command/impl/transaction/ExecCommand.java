package org.muma.redislite.command.impl.transaction;

import org.muma.redislite.command.CommandDispatcher;
import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

import java.util.List;

/**
 * EXEC
 * 依次执行事务队列里的命令，每条命令一个回复；某条失败不影响后面的命令。
 */
public class ExecCommand implements RedisCommand {

    private final CommandDispatcher dispatcher;

    public ExecCommand(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 1) return errorArgs("exec");

        List<RedisArray> queued = context.closeTransaction();
        if (queued == null) {
            throw new RedisException("ERR EXEC without MULTI");
        }
        return dispatcher.executeQueued(queued, context);
    }
}
