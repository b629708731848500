package org.muma.redislite.exception;

/**
 * SET 的 NX/XX 条件不满足 (或两者同时给出)
 */
public class CannotInsertException extends RedisException {

    public CannotInsertException(String key) {
        super("ERR value for key '" + key + "' not inserted: condition not met");
    }
}
