package org.muma.redislite.server;

import lombok.Getter;
import lombok.Setter;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.replication.ReplicaConnection;

import java.util.ArrayList;
import java.util.List;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的所有状态：事务队列、暂存的 Slave 描述、复制推送标记。
 * <p>
 * 只被该连接自己的工作线程访问。
 */
public class RedisContext {

    @Getter
    private final int clientId;

    @Getter
    private final String remoteAddress;

    // MULTI 之后的命令队列，null 表示不在事务中
    private List<RedisArray> transactionQueue;

    // REPLCONF listening-port 暂存，PSYNC 时取用
    @Getter
    @Setter
    private ReplicaConnection pendingReplica;

    // PSYNC 成功后置位，连接在回复写出后转入推送模式
    private ReplicaConnection streamingReplica;

    public RedisContext(int clientId, String remoteAddress) {
        this.clientId = clientId;
        this.remoteAddress = remoteAddress;
    }

    // --- 事务 ---

    public boolean isInTransaction() {
        return transactionQueue != null;
    }

    public void beginTransaction() {
        transactionQueue = new ArrayList<>();
    }

    public void queueCommand(RedisArray command) {
        transactionQueue.add(command);
    }

    /**
     * 取出并关闭事务队列 (EXEC / DISCARD)
     *
     * @return 排队的命令；不在事务中返回 null
     */
    public List<RedisArray> closeTransaction() {
        List<RedisArray> queued = transactionQueue;
        transactionQueue = null;
        return queued;
    }

    // --- 复制 ---

    public void startStreaming(ReplicaConnection replica) {
        this.streamingReplica = replica;
    }

    /**
     * 取走推送请求 (只会返回一次)
     */
    public ReplicaConnection takeStreamingReplica() {
        ReplicaConnection replica = streamingReplica;
        streamingReplica = null;
        return replica;
    }
}
