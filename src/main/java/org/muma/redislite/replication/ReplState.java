package org.muma.redislite.replication;

/**
 * Slave 端握手状态机
 * PING -> REPLCONF listening-port -> REPLCONF capa -> PSYNC -> 接收快照 -> 命令流
 */
public enum ReplState {
    NONE,               // 非 Slave (Master 模式)
    CONNECTING,         // TCP 连接中
    RECEIVE_PONG,       // 等待 PING 响应
    SEND_PORT,          // 已发送 REPLCONF listening-port，等待 OK
    SEND_CAPA,          // 已发送 REPLCONF capa，等待 OK
    RECEIVE_PSYNC,      // 已发送 PSYNC，等待 FULLRESYNC
    TRANSFER,           // 正在接收 RDB 快照
    CONNECTED           // 快照已应用，进入命令流
}
