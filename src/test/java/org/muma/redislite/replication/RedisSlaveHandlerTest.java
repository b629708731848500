package org.muma.redislite.replication;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.redislite.command.CommandDispatcher;
import org.muma.redislite.config.MiniRedisConfig;
import org.muma.redislite.protocol.RespDecoder;
import org.muma.redislite.protocol.RespEncoder;
import org.muma.redislite.store.SetOptions;
import org.muma.redislite.store.impl.MemoryStorageEngine;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Slave 端握手与命令流：Master 一侧用 EmbeddedChannel 模拟
 */
class RedisSlaveHandlerTest {

    private MemoryStorageEngine storage;
    private ReplicationManager manager;
    private CommandDispatcher dispatcher;
    private EmbeddedChannel master;

    @BeforeEach
    void setUp() {
        MiniRedisConfig config = new MiniRedisConfig();
        config.setPort(6380);
        config.setReplicaOfHost("localhost");
        config.setReplicaOfPort(6379);

        storage = new MemoryStorageEngine();
        manager = new ReplicationManager(config, storage);
        dispatcher = new CommandDispatcher(storage, manager);

        master = new EmbeddedChannel(new RespDecoder(), new RespEncoder(),
                new RedisSlaveHandler(manager, dispatcher, ImmediateEventExecutor.INSTANCE));
        manager.attachMasterChannel(master);
    }

    private void fromMaster(String raw) {
        master.writeInbound(Unpooled.copiedBuffer(raw, StandardCharsets.ISO_8859_1));
    }

    private String toMaster() {
        ByteBuf buf = master.readOutbound();
        if (buf == null) return null;
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    private void handshake() {
        handshakeUntilPsync();
        assertEquals("*3\r\n$5\r\nPSYNC\r\n$1\r\n?\r\n$2\r\n-1\r\n", toMaster());
        assertEquals(ReplState.RECEIVE_PSYNC, manager.getState());
    }

    private void handshakeUntilPsync() {
        manager.sendPing();
        assertEquals("*1\r\n$4\r\nPING\r\n", toMaster());

        fromMaster("+PONG\r\n");
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$14\r\nlistening-port\r\n$4\r\n6380\r\n", toMaster());

        fromMaster("+OK\r\n");
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$4\r\ncapa\r\n$6\r\npsync2\r\n", toMaster());

        fromMaster("+OK\r\n");
    }

    @Test
    void testHandshakeSequence() {
        handshake();

        fromMaster("+FULLRESYNC 8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb 0\r\n");
        assertEquals(ReplState.TRANSFER, manager.getState());
        assertEquals("8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb", manager.getMetadata().getCachedMasterReplId());

        fromMaster("$9\r\nREDIS0011");
        assertEquals(ReplState.CONNECTED, manager.getState());
    }

    @Test
    void testSnapshotAndCommandsInOnePacket() {
        handshake();

        fromMaster("+FULLRESYNC abc 0\r\n"
                + "$9\r\nREDIS0011"
                + "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"
                + "*3\r\n$5\r\nRPUSH\r\n$1\r\nl\r\n$1\r\nx\r\n");

        assertEquals(ReplState.CONNECTED, manager.getState());
        assertEquals("bar", storage.get("foo"));
        assertEquals(List.of("x"), storage.lrange("l", 0, -1));

        // 普通命令不回复 Master
        assertNull(toMaster());
    }

    @Test
    void testGetAckIsAnswered() {
        handshake();
        fromMaster("+FULLRESYNC abc 0\r\n$9\r\nREDIS0011");

        fromMaster("*3\r\n$8\r\nREPLCONF\r\n$6\r\nGETACK\r\n$1\r\n*\r\n");
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$3\r\nACK\r\n$1\r\n0\r\n", toMaster());
    }

    @Test
    void testAppliedCommandsAreNotForwarded() {
        handshake();
        fromMaster("+FULLRESYNC abc 0\r\n$9\r\nREDIS0011*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n");

        assertEquals(0, manager.getProducedBytes());
        assertTrue(manager.getMetadata().getReplOffset() > 0);
    }

    @Test
    void testFullResyncAfterReconnectDoesNotApplyTwice() {
        String replayedLog = "*3\r\n$5\r\nRPUSH\r\n$1\r\nl\r\n$1\r\na\r\n"
                + "*2\r\n$4\r\nINCR\r\n$1\r\nn\r\n";

        handshake();
        fromMaster("+FULLRESYNC abc 0\r\n$9\r\nREDIS0011" + replayedLog);
        assertEquals(List.of("a"), storage.lrange("l", 0, -1));
        assertEquals("1", storage.get("n"));

        // 链路断开后重连：新的连接再走一遍握手，Master 从日志开头重放
        master.close();
        master = new EmbeddedChannel(new RespDecoder(), new RespEncoder(),
                new RedisSlaveHandler(manager, dispatcher, ImmediateEventExecutor.INSTANCE));
        manager.attachMasterChannel(master);

        handshakeUntilPsync();
        assertTrue(toMaster().startsWith("*3\r\n$5\r\nPSYNC\r\n$3\r\nabc\r\n"));
        fromMaster("+FULLRESYNC abc 0\r\n$9\r\nREDIS0011" + replayedLog);

        assertEquals(ReplState.CONNECTED, manager.getState());
        assertEquals(List.of("a"), storage.lrange("l", 0, -1));
        assertEquals("1", storage.get("n"));
    }

    @Test
    void testSnapshotClearsStaleKeys() {
        storage.set("stale", "v", SetOptions.NONE);

        handshake();
        fromMaster("+FULLRESYNC abc 0\r\n$9\r\nREDIS0011");

        assertNull(storage.get("stale"));
    }

    @Test
    void testMasterErrorClosesLink() {
        manager.sendPing();
        toMaster();

        fromMaster("-ERR go away\r\n");
        assertFalse(master.isActive());
    }
}
