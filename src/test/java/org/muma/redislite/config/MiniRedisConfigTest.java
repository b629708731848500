package org.muma.redislite.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MiniRedisConfigTest {

    @Test
    void testDefaults() {
        MiniRedisConfig config = new MiniRedisConfig();
        assertEquals(6379, config.getPort());
        assertFalse(config.isReplica());
        assertEquals(88, config.getSnapshot().length);
    }

    @Test
    void testCommandLine() {
        MiniRedisConfig config = new MiniRedisConfig();
        config.parseArgs(new String[]{"--port", "6380", "--replicaof", "localhost 6379"});

        assertEquals(6380, config.getPort());
        assertTrue(config.isReplica());
        assertEquals("localhost", config.getReplicaOfHost());
        assertEquals(6379, config.getReplicaOfPort());
    }

    @Test
    void testReplicaOfAsTwoArguments() {
        MiniRedisConfig config = new MiniRedisConfig();
        config.parseArgs(new String[]{"--replicaof", "127.0.0.1", "7001", "--port", "7002"});

        assertEquals("127.0.0.1", config.getReplicaOfHost());
        assertEquals(7001, config.getReplicaOfPort());
        assertEquals(7002, config.getPort());
    }

    @Test
    void testInvalidPortRejected() {
        MiniRedisConfig config = new MiniRedisConfig();
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port", "abc"}));
    }

    @Test
    void testPropertiesFile() {
        MiniRedisConfig config = new MiniRedisConfig();
        config.loadConfig("replica-test.properties");

        assertEquals(6390, config.getPort());
        assertEquals("10.0.0.5", config.getReplicaOfHost());
        assertEquals(7000, config.getReplicaOfPort());
    }

    @Test
    void testMissingFileKeepsDefaults() {
        MiniRedisConfig config = new MiniRedisConfig();
        config.loadConfig("does-not-exist.properties");
        assertEquals(6379, config.getPort());
    }

    @Test
    void testEnvironmentOverridesFileAndArgsOverrideEnvironment() {
        MiniRedisConfig config = new MiniRedisConfig();
        config.loadConfig("replica-test.properties");
        config.applyEnvOverrides(Map.of("REDIS_PORT", "6400", "REDIS_REPLICAOF", "master.local 6500"));

        assertEquals(6400, config.getPort());
        assertEquals("master.local", config.getReplicaOfHost());
        assertEquals(6500, config.getReplicaOfPort());

        config.parseArgs(new String[]{"--port", "6401"});
        assertEquals(6401, config.getPort());
    }
}
