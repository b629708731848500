package org.muma.redislite.replication;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import lombok.Getter;
import org.muma.redislite.command.CommandDispatcher;
import org.muma.redislite.config.MiniRedisConfig;
import org.muma.redislite.exception.ReplicaNotAvailableException;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RespDecoder;
import org.muma.redislite.protocol.RespEncoder;
import org.muma.redislite.store.StorageEngine;
import org.muma.redislite.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 复制管理器 (Replication Bridge)
 * 同时负责 Master 和 Slave 的角色逻辑，角色在构造时确定。
 * <p>
 * Master: 维护复制日志，每个 Slave 一个推送循环，按自己的游标追日志。
 * Slave: 连接 Master 完成握手，应用快照，然后执行 Master 推送过来的命令流。
 */
public class ReplicationManager {

    private static final Logger log = LoggerFactory.getLogger(ReplicationManager.class);

    @Getter
    private final ReplRole role;
    @Getter
    private final ReplicationMetadata metadata = new ReplicationMetadata();

    // --- Master 角色字段 ---
    private final ReplicationLog replicationLog = new ReplicationLog();
    private final Set<ReplicaConnection> replicas = new CopyOnWriteArraySet<>();
    private final byte[] snapshot;

    // --- Slave 角色字段 ---
    // 全量同步时清空
    private final StorageEngine storage;
    @Getter
    private volatile ReplState state = ReplState.NONE;
    private final String masterHost;
    private final int masterPort;
    private final int ownPort;
    private volatile Channel masterChannel;
    private EventLoopGroup replicaGroup;
    private volatile boolean shutdown = false;

    public ReplicationManager(MiniRedisConfig config, StorageEngine storage) {
        this.storage = storage;
        this.role = config.isReplica() ? ReplRole.REPLICA : ReplRole.MASTER;
        this.snapshot = config.getSnapshot();
        this.masterHost = config.getReplicaOfHost();
        this.masterPort = config.getReplicaOfPort();
        this.ownPort = config.getPort();
    }

    public boolean isMaster() {
        return role == ReplRole.MASTER;
    }

    // =========================================================
    // Master 角色逻辑
    // =========================================================

    /**
     * 写命令执行成功后追加到复制日志，并唤醒等待中的推送循环
     */
    public void queueCommand(RedisArray command) {
        if (!isMaster()) return;

        byte[] bytes = RespCodecUtil.encode(command);
        replicationLog.append(bytes);
        metadata.addOffset(bytes.length);
    }

    /**
     * PSYNC：正式注册一个 Slave
     */
    public void register(ReplicaConnection replica) {
        if (replica == null) {
            throw new ReplicaNotAvailableException();
        }
        replicas.add(replica);
        log.info("Replica registered: {}, total replicas: {}", replica, replicas.size());
    }

    /**
     * Slave 断开：退出它的推送循环
     */
    public void remove(ReplicaConnection replica) {
        if (replica != null && replicas.remove(replica)) {
            replica.close();
            replicationLog.wakeAll();
            log.info("Replica removed: {}", replica);
        }
    }

    public int connectedReplicas() {
        return replicas.size();
    }

    /**
     * 快照帧，紧跟在 +FULLRESYNC 之后发送
     */
    public RdbTransfer getRdb(ReplicaConnection replica) {
        if (replica == null) {
            throw new ReplicaNotAvailableException();
        }
        return RdbTransfer.of(snapshot);
    }

    /**
     * Slave 推送循环 (在该 Slave 连接的工作线程上运行，直到 Slave 断开)
     * <p>
     * 游标从日志开头开始：快照只是占位，Slave 靠重放完整日志追上 Master 的状态。
     */
    public void startConsuming(ReplicaConnection replica, Consumer<byte[]> sender) {
        log.info("Start streaming commands to {}", replica);
        try {
            while (!replica.isClosed()) {
                byte[] entry = replicationLog.awaitEntry(replica.getCursor(), replica);
                if (entry == null) break;
                sender.accept(entry);
                replica.advance();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Streaming to {} interrupted", replica);
        } catch (RuntimeException e) {
            log.error("Streaming to {} failed", replica, e);
        } finally {
            remove(replica);
        }
        log.info("Stop streaming commands to {}", replica);
    }

    public long getProducedBytes() {
        return replicationLog.getProducedBytes();
    }

    /**
     * INFO replication
     */
    public String info() {
        StringBuilder sb = new StringBuilder();
        sb.append("# Replication\r\n");
        sb.append("role:").append(role.infoName()).append("\r\n");
        if (isMaster()) {
            sb.append("connected_slaves:").append(replicas.size()).append("\r\n");
        } else {
            sb.append("master_host:").append(masterHost).append("\r\n");
            sb.append("master_port:").append(masterPort).append("\r\n");
            sb.append("master_link_status:").append(state == ReplState.CONNECTED ? "up" : "down").append("\r\n");
        }
        sb.append("master_replid:").append(isMaster() ? metadata.getMyReplId() : metadata.getCachedMasterReplId()).append("\r\n");
        sb.append("master_repl_offset:").append(isMaster() ? getProducedBytes() : metadata.getReplOffset()).append("\r\n");
        return sb.toString();
    }

    // =========================================================
    // Slave 角色逻辑
    // =========================================================

    /**
     * 启动到 Master 的复制连接 (仅 Slave)
     *
     * @param dispatcher 用于执行 Master 推送的命令；Slave 不会再向下游转发
     */
    public void startReplication(CommandDispatcher dispatcher) {
        if (isMaster()) return;

        replicaGroup = new NioEventLoopGroup(1);
        log.info("REPLICAOF {}:{} enabled", masterHost, masterPort);
        connectToMaster(dispatcher);
    }

    private void connectToMaster(CommandDispatcher dispatcher) {
        if (shutdown) return;
        state = ReplState.CONNECTING;

        Bootstrap b = new Bootstrap();
        b.group(replicaGroup)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new RedisSlaveHandler(ReplicationManager.this, dispatcher));
                    }
                });

        b.connect(masterHost, masterPort).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                log.info("Connected to master {}:{}", masterHost, masterPort);
                masterChannel = future.channel();
                masterChannel.closeFuture().addListener(f -> onMasterLinkClosed(dispatcher));
                sendPing();
            } else {
                log.warn("Failed to connect to master {}:{}, retrying in 1s...", masterHost, masterPort);
                scheduleReconnect(dispatcher);
            }
        });
    }

    private void onMasterLinkClosed(CommandDispatcher dispatcher) {
        log.warn("Connection to master lost (state: {})", state);
        masterChannel = null;
        scheduleReconnect(dispatcher);
    }

    private void scheduleReconnect(CommandDispatcher dispatcher) {
        if (shutdown || replicaGroup.isShuttingDown()) return;
        state = ReplState.CONNECTING;
        replicaGroup.schedule(() -> connectToMaster(dispatcher), 1, TimeUnit.SECONDS);
    }

    // --- State Actions ---

    void sendPing() {
        state = ReplState.RECEIVE_PONG;
        writeToMaster(RedisArray.of("PING"));
    }

    void sendReplConfPort() {
        state = ReplState.SEND_PORT;
        writeToMaster(RedisArray.of("REPLCONF", "listening-port", String.valueOf(ownPort)));
    }

    void sendReplConfCapa() {
        state = ReplState.SEND_CAPA;
        writeToMaster(RedisArray.of("REPLCONF", "capa", "psync2"));
    }

    void sendPsync() {
        state = ReplState.RECEIVE_PSYNC;
        String replId = metadata.getCachedMasterReplId();
        String offset = "?".equals(replId) ? "-1" : String.valueOf(metadata.getReplOffset());
        writeToMaster(RedisArray.of("PSYNC", replId, offset));
    }

    // --- Callbacks for Handler ---

    void handleFullResync(String replId, long offset) {
        log.info("Full resync triggered. Master ReplId: {}, Offset: {}", replId, offset);
        state = ReplState.TRANSFER;
        metadata.setCachedMasterReplId(replId);
        metadata.setReplOffset(offset);
    }

    /**
     * 快照应用回调：快照内容是不透明的占位数据。
     * Master 随后从日志开头重放，所以本地 Keyspace 先清空。
     */
    void handleSnapshot(byte[] rdb) {
        log.info("Received RDB snapshot from master: {} bytes", rdb.length);
        storage.flushAll();
        state = ReplState.CONNECTED;
    }

    void writeToMaster(RedisArray msg) {
        Channel channel = masterChannel;
        if (channel != null && channel.isActive()) {
            channel.writeAndFlush(msg);
        }
    }

    // 测试中直接注入 Channel (EmbeddedChannel)
    void attachMasterChannel(Channel channel) {
        this.masterChannel = channel;
    }

    public void shutdown() {
        shutdown = true;
        replicas.forEach(this::remove);
        if (masterChannel != null) {
            masterChannel.close();
        }
        if (replicaGroup != null) {
            replicaGroup.shutdownGracefully();
        }
    }
}
