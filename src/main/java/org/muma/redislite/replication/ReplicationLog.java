package org.muma.redislite.replication;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Master 的复制日志 (只追加)
 * <p>
 * 单写多读：写命令的工作线程追加，每个 Slave 的推送线程拿着自己的游标读。
 * 没有截断，会随进程一直增长。
 */
public class ReplicationLog {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();

    private final List<byte[]> entries = new ArrayList<>();
    private long producedBytes = 0;

    /**
     * 追加一条已编码的命令，并唤醒所有在等新数据的推送线程
     */
    public void append(byte[] command) {
        lock.lock();
        try {
            entries.add(command);
            producedBytes += command.length;
            appended.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 取 cursor 位置的日志；游标到达队尾时阻塞，直到有新追加或 Slave 被关闭
     *
     * @return 日志内容；Slave 已关闭返回 null
     */
    public byte[] awaitEntry(int cursor, ReplicaConnection replica) throws InterruptedException {
        lock.lock();
        try {
            while (cursor >= entries.size()) {
                if (replica.isClosed()) return null;
                appended.await();
            }
            return replica.isClosed() ? null : entries.get(cursor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 唤醒所有等待者 (Slave 断开时用，让它的推送线程退出)
     */
    public void wakeAll() {
        lock.lock();
        try {
            appended.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long getProducedBytes() {
        lock.lock();
        try {
            return producedBytes;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
