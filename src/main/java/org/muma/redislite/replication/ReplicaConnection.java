package org.muma.redislite.replication;

import lombok.Getter;

/**
 * Master 侧登记的一个 Slave
 * REPLCONF listening-port 时创建 (暂存在连接上下文里)，PSYNC 时正式注册。
 */
public class ReplicaConnection {

    @Getter
    private final String address;

    @Getter
    private final int listeningPort;

    // 已经发送到的日志下标
    @Getter
    private int cursor = 0;

    private volatile boolean closed = false;

    public ReplicaConnection(String address, int listeningPort) {
        this.address = address;
        this.listeningPort = listeningPort;
    }

    void advance() {
        cursor++;
    }

    public boolean isClosed() {
        return closed;
    }

    void close() {
        this.closed = true;
    }

    @Override
    public String toString() {
        return "Replica{" + address + ", port=" + listeningPort + ", cursor=" + cursor + "}";
    }
}
