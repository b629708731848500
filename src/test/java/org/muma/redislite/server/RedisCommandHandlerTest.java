package org.muma.redislite.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.redislite.command.CommandDispatcher;
import org.muma.redislite.config.MiniRedisConfig;
import org.muma.redislite.protocol.RespDecoder;
import org.muma.redislite.protocol.RespEncoder;
import org.muma.redislite.replication.ReplicationManager;
import org.muma.redislite.store.impl.MemoryStorageEngine;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RedisCommandHandlerTest {

    private ReplicationManager replicationManager;
    private CommandDispatcher dispatcher;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        MemoryStorageEngine storage = new MemoryStorageEngine();
        replicationManager = new ReplicationManager(new MiniRedisConfig(), storage);
        dispatcher = new CommandDispatcher(storage, replicationManager);
        channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(),
                new RedisCommandHandler(dispatcher, replicationManager, id -> ImmediateEventExecutor.INSTANCE));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
        replicationManager.shutdown();
    }

    private void send(String raw) {
        channel.writeInbound(Unpooled.copiedBuffer(raw, StandardCharsets.UTF_8));
    }

    private String reply() {
        ByteBuf buf = channel.readOutbound();
        assertNotNull(buf, "Expected a reply");
        try {
            return buf.toString(StandardCharsets.ISO_8859_1);
        } finally {
            buf.release();
        }
    }

    @Test
    void testPing() {
        send("*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", reply());
    }

    @Test
    void testPipelinedCommandsAnsweredInOrder() {
        send("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n*2\r\n$4\r\nINCR\r\n$1\r\nk\r\n");

        assertEquals("+OK\r\n", reply());
        assertEquals("$1\r\nv\r\n", reply());
        assertEquals("-ERR value is not an integer or out of range\r\n", reply());
    }

    @Test
    void testProtocolErrorKeepsConnectionOpen() {
        send("!garbage\r\n");
        assertTrue(reply().startsWith("-ERR Protocol error"));
        assertTrue(channel.isActive());

        send("*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", reply());
    }

    @Test
    void testProtocolErrorReplyWaitsForBlockedCommand() throws Exception {
        // 真实的工作线程：BLPOP 挂起期间到达的坏报文，其错误回复必须排在 BLPOP 的回复之后
        DefaultEventExecutor worker = new DefaultEventExecutor();
        channel.finishAndReleaseAll();
        channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(),
                new RedisCommandHandler(dispatcher, replicationManager, id -> worker));

        send("*3\r\n$5\r\nBLPOP\r\n$1\r\nl\r\n$3\r\n0.3\r\n");
        send("!garbage\r\n");
        send("+PING\r\n");

        // 排一个空任务，等前面的任务全部跑完
        worker.submit(() -> { }).get(5, TimeUnit.SECONDS);

        assertEquals("*-1\r\n", reply());
        assertTrue(reply().startsWith("-ERR Protocol error: unknown RESP type"));
        assertTrue(reply().startsWith("-ERR Protocol error: expected array"));
        worker.shutdownGracefully();
    }

    @Test
    void testNonArrayMessageRejected() {
        send("+PING\r\n");
        assertTrue(reply().startsWith("-ERR Protocol error"));
    }

    @Test
    void testPsyncWithoutReplconfFails() {
        send("*3\r\n$5\r\nPSYNC\r\n$1\r\n?\r\n$2\r\n-1\r\n");
        assertTrue(reply().startsWith("-ERR replica not available"));
        assertEquals(0, replicationManager.connectedReplicas());
    }

    @Test
    void testReplicaHandshakeSendsFullResyncThenSnapshot() {
        send("*3\r\n$8\r\nREPLCONF\r\n$14\r\nlistening-port\r\n$4\r\n6380\r\n");
        assertEquals("+OK\r\n", reply());
        send("*3\r\n$8\r\nREPLCONF\r\n$4\r\ncapa\r\n$6\r\npsync2\r\n");
        assertEquals("+OK\r\n", reply());

        send("*3\r\n$5\r\nPSYNC\r\n$1\r\n?\r\n$2\r\n-1\r\n");
        String replId = replicationManager.getMetadata().getMyReplId();
        assertEquals("+FULLRESYNC " + replId + " 0\r\n", reply());

        String rdb = reply();
        assertTrue(rdb.startsWith("$88\r\nREDIS0011"));
        assertEquals(88 + 5, rdb.length());
        assertEquals(1, replicationManager.connectedReplicas());

        // 连接断开后 Slave 被移除
        channel.close();
        assertEquals(0, replicationManager.connectedReplicas());
    }

    @Test
    void testSecondPsyncOnSameConnectionRejected() {
        send("*3\r\n$8\r\nREPLCONF\r\n$14\r\nlistening-port\r\n$4\r\n6380\r\n");
        assertEquals("+OK\r\n", reply());
        send("*3\r\n$5\r\nPSYNC\r\n$1\r\n?\r\n$2\r\n-1\r\n");
        assertTrue(reply().startsWith("+FULLRESYNC"));
        assertTrue(reply().startsWith("$88\r\n"));

        send("*3\r\n$5\r\nPSYNC\r\n$1\r\n?\r\n$2\r\n-1\r\n");
        assertTrue(reply().startsWith("-ERR replica not available"));
        assertEquals(1, replicationManager.connectedReplicas());
    }

    @Test
    void testInfoReportsRole() {
        send("*2\r\n$4\r\nINFO\r\n$11\r\nreplication\r\n");
        String info = reply();
        assertTrue(info.contains("role:master"));
        assertTrue(info.contains("master_repl_offset:0"));
    }
}
