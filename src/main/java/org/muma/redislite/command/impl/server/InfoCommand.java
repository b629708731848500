package org.muma.redislite.command.impl.server;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.replication.ReplicationManager;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * INFO [section ...]
 * 只有 replication 一节，参数中的 section 不做过滤
 */
public class InfoCommand implements RedisCommand {

    private final ReplicationManager replicationManager;

    public InfoCommand(ReplicationManager replicationManager) {
        this.replicationManager = replicationManager;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return new BulkString(replicationManager.info());
    }
}
