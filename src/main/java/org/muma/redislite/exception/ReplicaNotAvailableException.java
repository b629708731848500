package org.muma.redislite.exception;

/**
 * PSYNC 之前没有 REPLCONF listening-port 登记 Slave
 */
public class ReplicaNotAvailableException extends RedisException {

    public ReplicaNotAvailableException() {
        super("ERR replica not available: send REPLCONF listening-port before PSYNC");
    }
}
