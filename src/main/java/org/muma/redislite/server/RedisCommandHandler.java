package org.muma.redislite.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.util.concurrent.EventExecutor;
import org.muma.redislite.command.CommandDispatcher;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.ErrorMessage;
import org.muma.redislite.protocol.ProtocolException;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.replication.RdbTransfer;
import org.muma.redislite.replication.ReplicaConnection;
import org.muma.redislite.replication.ReplicationManager;
import org.muma.redislite.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * 客户端连接 Handler
 * <p>
 * 每个连接有自己的单线程工作执行器，命令按到达顺序在上面执行；
 * BLPOP / XREAD BLOCK 挂起的是这个工作线程，不会卡住 Netty 的 IO 线程和其他连接。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private static final AtomicInteger CLIENT_ID_SEQ = new AtomicInteger();
    private static final AtomicInteger CONNECTED_CLIENTS = new AtomicInteger();
    private static final ThreadFactory STREAMER_THREADS = ThreadUtils.namedThreadFactory("redis-repl-stream");

    private final CommandDispatcher dispatcher;
    private final ReplicationManager replicationManager;
    private final IntFunction<EventExecutor> workerFactory;

    private EventExecutor worker;
    private RedisContext context;
    // PSYNC 之后这个连接就是一个 Slave
    private volatile ReplicaConnection replica;

    public RedisCommandHandler(CommandDispatcher dispatcher, ReplicationManager replicationManager) {
        this(dispatcher, replicationManager, ThreadUtils::newClientWorker);
    }

    RedisCommandHandler(CommandDispatcher dispatcher, ReplicationManager replicationManager,
                        IntFunction<EventExecutor> workerFactory) {
        this.dispatcher = dispatcher;
        this.replicationManager = replicationManager;
        this.workerFactory = workerFactory;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int clientId = CLIENT_ID_SEQ.incrementAndGet();
        this.context = new RedisContext(clientId, String.valueOf(ctx.channel().remoteAddress()));
        this.worker = workerFactory.apply(clientId);
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), CONNECTED_CLIENTS.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), CONNECTED_CLIENTS.decrementAndGet());
        if (replica != null) {
            replicationManager.remove(replica);
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (msg instanceof RedisArray array && !array.isNull()) {
            worker.execute(() -> handleCommand(ctx, array));
        } else {
            log.warn("Received non-array message: {}", msg);
            replyInOrder(ctx, new ErrorMessage("ERR Protocol error: expected array of bulk strings"));
        }
    }

    private void handleCommand(ChannelHandlerContext ctx, RedisArray command) {
        if (log.isDebugEnabled()) {
            log.debug("Execute Command from client {}: {}", context.getClientId(), describe(command));
        }

        RedisMessage response = dispatcher.dispatch(command, context);
        ctx.writeAndFlush(response);

        ReplicaConnection streaming = context.takeStreamingReplica();
        if (streaming != null) {
            startStreaming(ctx, streaming);
        }
    }

    /**
     * FULLRESYNC 已经写出：紧跟着发送快照，然后在单独的线程上推送复制日志
     */
    private void startStreaming(ChannelHandlerContext ctx, ReplicaConnection streaming) {
        this.replica = streaming;
        RdbTransfer rdb = replicationManager.getRdb(streaming);
        ctx.writeAndFlush(Unpooled.wrappedBuffer(rdb.toBytes()));

        Thread streamer = STREAMER_THREADS.newThread(() ->
                replicationManager.startConsuming(streaming, bytes -> ctx.writeAndFlush(Unpooled.wrappedBuffer(bytes))));
        streamer.start();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        if (root instanceof ProtocolException) {
            // 解码器已经丢弃了脏数据，连接继续可用
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), root.getMessage());
            replyInOrder(ctx, new ErrorMessage("ERR Protocol error: " + root.getMessage()));
            return;
        }
        log.error("Unexpected error on connection {}, closing", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    /**
     * 错误回复也排在工作线程上，保证回复顺序和请求顺序一致 (前面可能还有执行中的阻塞命令)
     */
    private void replyInOrder(ChannelHandlerContext ctx, RedisMessage reply) {
        if (worker == null) {
            ctx.writeAndFlush(reply);
            return;
        }
        worker.execute(() -> ctx.writeAndFlush(reply));
    }

    private static String describe(RedisArray command) {
        StringBuilder sb = new StringBuilder();
        for (RedisMessage element : command.elements()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(element instanceof BulkString bs ? bs.asString() : "<?>");
        }
        return sb.toString();
    }
}
