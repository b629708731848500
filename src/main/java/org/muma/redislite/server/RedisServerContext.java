package org.muma.redislite.server;

import lombok.Getter;
import org.muma.redislite.command.CommandDispatcher;
import org.muma.redislite.config.MiniRedisConfig;
import org.muma.redislite.replication.ReplicationManager;
import org.muma.redislite.store.StorageEngine;
import org.muma.redislite.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redis 服务器上下文
 * 负责组装各个模块，管理生命周期。
 */
public class RedisServerContext {

    private static final Logger log = LoggerFactory.getLogger(RedisServerContext.class);

    @Getter
    private final ReplicationManager replicationManager;
    @Getter
    private final CommandDispatcher dispatcher;

    public RedisServerContext(MiniRedisConfig config) {
        // 1. Storage
        StorageEngine storage = new MemoryStorageEngine();

        // 2. Replication (角色由配置决定)
        this.replicationManager = new ReplicationManager(config, storage);

        // 3. Dispatcher
        this.dispatcher = new CommandDispatcher(storage, replicationManager);
    }

    /**
     * 端口绑定成功后调用：Slave 开始连接 Master，注册关闭钩子
     */
    public void init() {
        log.info("Server role: {}", replicationManager.getRole().infoName());
        replicationManager.startReplication(dispatcher);
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "redis-shutdown"));
    }

    public void shutdown() {
        log.info("Shutting down server context");
        replicationManager.shutdown();
    }
}
