package org.muma.redislite.utils;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程工厂与工作线程
 * <p>
 * 每个客户端连接 (以及 Slave 的复制链路) 有一个独立的单线程执行器，
 * 命令在它上面串行执行，阻塞命令只会挂住这一个连接。
 */
public class ThreadUtils {

    private ThreadUtils() {
    }

    public static ThreadFactory namedThreadFactory(String prefix) {
        return new RedisThreadFactory(prefix);
    }

    /**
     * 客户端连接的命令执行线程: redis-client-{clientId}
     */
    public static EventExecutor newClientWorker(int clientId) {
        return new DefaultEventExecutor(new RedisThreadFactory("redis-client-" + clientId));
    }

    /**
     * Slave 端应用 Master 命令流的线程
     */
    public static EventExecutor newReplicationWorker() {
        return new DefaultEventExecutor(new RedisThreadFactory("redis-repl-apply"));
    }

    private static class RedisThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        RedisThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
