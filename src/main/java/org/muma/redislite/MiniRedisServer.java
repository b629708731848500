package org.muma.redislite;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.redislite.config.MiniRedisConfig;
import org.muma.redislite.protocol.RespDecoder;
import org.muma.redislite.protocol.RespEncoder;
import org.muma.redislite.server.RedisCommandHandler;
import org.muma.redislite.server.RedisServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MiniRedisServer {

    private static final Logger log = LoggerFactory.getLogger(MiniRedisServer.class);

    private final MiniRedisConfig config;

    public MiniRedisServer(MiniRedisConfig config) {
        this.config = config;
    }

    public void start() throws InterruptedException {
        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup();

        RedisServerContext serverContext = new RedisServerContext(config);

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new RespDecoder())
                                    .addLast(new RespEncoder())
                                    .addLast(new RedisCommandHandler(serverContext.getDispatcher(),
                                            serverContext.getReplicationManager()));
                        }
                    });

            log.info("Starting Mini-Redis server on port {}", config.getPort());
            ChannelFuture future = bootstrap.bind(config.getPort()).sync();

            serverContext.init();

            log.info("Mini-Redis started successfully.");
            future.channel().closeFuture().sync();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            throw e;
        } finally {
            serverContext.shutdown();
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        MiniRedisConfig config = MiniRedisConfig.load(args);
        new MiniRedisServer(config).start();
    }
}
