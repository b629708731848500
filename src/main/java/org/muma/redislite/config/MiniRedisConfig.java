package org.muma.redislite.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HexFormat;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (redis.properties) > 默认值
 */
@Getter
@Setter
public class MiniRedisConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniRedisConfig.class);

    /**
     * 空 RDB 文件 (REDIS0011 + 辅助字段 + EOF + 校验和)，FULLRESYNC 时作为占位快照发送
     */
    public static final String EMPTY_RDB_HEX =
            "524544495330303131fa0972656469732d76657205372e322e30fa0a72656469732d62697473c040fa056374696d65c26d08bc65fa08757365642d6d656dc2b0c41000fa08616f662d62617365c000fff06e3bfec0ff5aa2";

    // --- Core Settings ---
    private int port = 6379;

    private String configFilePath = "redis.properties";

    // --- Replication ---
    private String replicaOfHost = null;
    private int replicaOfPort = -1;

    private byte[] snapshot = HexFormat.of().parseHex(EMPTY_RDB_HEX);

    public MiniRedisConfig() {
    }

    /**
     * 完整加载流程：配置文件 -> 环境变量 -> 命令行
     */
    public static MiniRedisConfig load(String[] args) {
        MiniRedisConfig config = new MiniRedisConfig();
        // 先扫一遍 --config，决定配置文件路径
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config.configFilePath = args[i + 1];
            }
        }
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(System.getenv());
        config.parseArgs(args);
        log.info("MiniRedisConfig initialized: {}", config);
        return config;
    }

    public boolean isReplica() {
        return replicaOfHost != null;
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) && i + 1 < args.length) {
                i++;
            } else if ("--port".equals(arg) && i + 1 < args.length) {
                this.port = parsePort(args[++i]);
            } else if (("--replicaof".equals(arg) || "--slaveof".equals(arg)) && i + 1 < args.length) {
                String value = args[++i];
                // 既支持 --replicaof "host port"，也支持 --replicaof host port
                if (!value.contains(" ") && i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    value = value + " " + args[++i];
                }
                applyReplicaOf(value);
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.port = getInt(props, "server.port", this.port);

        String replicaOf = getString(props, "replicaof", "");
        if (!replicaOf.isBlank()) {
            applyReplicaOf(replicaOf);
        }

        String snapshotHex = getString(props, "replication.snapshot", "");
        if (!snapshotHex.isBlank()) {
            try {
                this.snapshot = HexFormat.of().parseHex(snapshotHex.trim());
            } catch (IllegalArgumentException e) {
                log.warn("Invalid replication.snapshot hex, using the empty RDB placeholder.");
            }
        }
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("REDIS_PORT");
        if (envPort != null) {
            this.port = parsePort(envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envReplicaOf = env.get("REDIS_REPLICAOF");
        if (envReplicaOf != null && !envReplicaOf.isBlank()) {
            applyReplicaOf(envReplicaOf);
            log.info("Replica of overridden by ENV: {}:{}", replicaOfHost, replicaOfPort);
        }
    }

    /**
     * 格式: "<host> <port>"
     */
    private void applyReplicaOf(String value) {
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            log.warn("Invalid replicaof config format: {}", value);
            return;
        }
        try {
            this.replicaOfPort = Integer.parseInt(parts[1]);
            this.replicaOfHost = parts[0];
        } catch (NumberFormatException e) {
            log.warn("Invalid replicaof port: {}", parts[1]);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private int parsePort(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parsePort(val) : defaultValue;
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", replicaOf=" + (isReplica() ? replicaOfHost + ":" + replicaOfPort : "none") + "}";
    }
}
