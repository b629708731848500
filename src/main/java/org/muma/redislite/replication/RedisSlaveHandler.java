package org.muma.redislite.replication;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.util.concurrent.EventExecutor;
import org.muma.redislite.command.CommandDispatcher;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.ErrorMessage;
import org.muma.redislite.protocol.RdbSnapshot;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.RespDecoder;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.utils.RespCodecUtil;
import org.muma.redislite.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slave 端的 Netty Handler
 * 负责处理 Master 发回的握手响应、RDB 数据流、Command 传播流。
 */
public class RedisSlaveHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger log = LoggerFactory.getLogger(RedisSlaveHandler.class);

    // Slave 链路的上下文 id，不会和客户端连接冲突
    private static final int REPLICATION_CLIENT_ID = -1;

    private final ReplicationManager manager;
    private final CommandDispatcher dispatcher;
    // Master 推送的命令在这里执行，BLPOP 之类不会卡住 IO 线程
    private final EventExecutor applier;
    private final RedisContext replicationContext;

    public RedisSlaveHandler(ReplicationManager manager, CommandDispatcher dispatcher) {
        this(manager, dispatcher, ThreadUtils.newReplicationWorker());
    }

    RedisSlaveHandler(ReplicationManager manager, CommandDispatcher dispatcher, EventExecutor applier) {
        this.manager = manager;
        this.dispatcher = dispatcher;
        this.applier = applier;
        this.replicationContext = new RedisContext(REPLICATION_CLIENT_ID, "master");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        ReplState state = manager.getState();

        if (msg instanceof ErrorMessage err) {
            log.error("Master responded error: {}", err.content());
            ctx.close();
            return;
        }

        switch (state) {
            case RECEIVE_PONG:
                if ("PONG".equalsIgnoreCase(content(msg))) {
                    log.info("Master PONG received.");
                    manager.sendReplConfPort();
                }
                break;

            case SEND_PORT:
                if (isOk(msg)) {
                    manager.sendReplConfCapa();
                }
                break;

            case SEND_CAPA:
                if (isOk(msg)) {
                    manager.sendPsync();
                }
                break;

            case RECEIVE_PSYNC:
                String resp = content(msg);
                if (resp.startsWith("FULLRESYNC")) {
                    String[] parts = resp.split(" ");
                    if (parts.length < 3) {
                        log.error("Malformed FULLRESYNC reply: {}", resp);
                        ctx.close();
                        return;
                    }
                    manager.handleFullResync(parts[1], Long.parseLong(parts[2]));
                    // 下一帧是 $len\r\n<rdb>，没有结尾的 CRLF
                    ctx.pipeline().get(RespDecoder.class).expectSnapshot();
                } else {
                    log.warn("Unexpected PSYNC reply: {}", msg);
                }
                break;

            case TRANSFER:
                if (msg instanceof RdbSnapshot snapshot) {
                    manager.handleSnapshot(snapshot.content());
                } else {
                    log.warn("Expected RDB snapshot, got: {}", msg);
                }
                break;

            case CONNECTED:
                if (msg instanceof RedisArray command) {
                    apply(ctx, command);
                } else {
                    log.warn("Ignoring non-command message from master: {}", msg);
                }
                break;

            default:
                log.warn("Message from master in state {}: {}", state, msg);
        }
    }

    /**
     * 执行 Master 传播过来的写命令。只有 REPLCONF GETACK 需要回复 Master。
     */
    private void apply(ChannelHandlerContext ctx, RedisArray command) {
        applier.execute(() -> {
            RedisMessage reply = dispatcher.dispatch(command, replicationContext);
            manager.getMetadata().addOffset(RespCodecUtil.encode(command).length);

            if (isGetAck(command)) {
                ctx.writeAndFlush(reply);
            } else if (reply instanceof ErrorMessage err) {
                log.warn("Replicated command failed: {}", err.content());
            }
        });
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Replication link to master closed");
        applier.shutdownGracefully();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Replication link error, closing", cause);
        ctx.close();
    }

    private static boolean isGetAck(RedisArray command) {
        if (command.size() < 2) return false;
        return "REPLCONF".equalsIgnoreCase(bulk(command, 0)) && "GETACK".equalsIgnoreCase(bulk(command, 1));
    }

    private static String bulk(RedisArray command, int index) {
        return command.elements()[index] instanceof BulkString bs ? bs.asString() : null;
    }

    private static boolean isOk(Object msg) {
        return msg instanceof SimpleString ss && "OK".equalsIgnoreCase(ss.content());
    }

    private static String content(Object msg) {
        if (msg instanceof SimpleString ss) return ss.content();
        return "";
    }
}
