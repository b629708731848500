package org.muma.redislite.command.impl.replication;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.replication.ReplicaConnection;
import org.muma.redislite.replication.ReplicationManager;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * PSYNC replid offset
 * <p>
 * 总是全量同步：注册之前 REPLCONF listening-port 暂存的 Slave，回复 FULLRESYNC，
 * 连接层在写出回复后发送快照并开始推送复制日志。
 */
public class PsyncCommand implements RedisCommand {

    private final ReplicationManager replicationManager;

    public PsyncCommand(ReplicationManager replicationManager) {
        this.replicationManager = replicationManager;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 3) return errorArgs("psync");

        // 暂存的 Slave 只能被 PSYNC 取用一次，同一连接上再次 PSYNC 会报错
        ReplicaConnection replica = context.getPendingReplica();
        replicationManager.register(replica);
        context.setPendingReplica(null);
        context.startStreaming(replica);

        String replId = replicationManager.getMetadata().getMyReplId();
        return new SimpleString("FULLRESYNC " + replId + " " + replicationManager.getProducedBytes());
    }
}
