package org.muma.redislite.common;

public enum RedisDataType {
    STRING("string"),
    LIST("list"),
    STREAM("stream");

    private final String typeName;

    RedisDataType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * TYPE 命令的返回值
     */
    public String typeName() {
        return typeName;
    }
}
