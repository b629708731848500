package org.muma.redislite.protocol;

import java.util.List;

// 5. 数组 (*) - elements 为 null 表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);
    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    /**
     * 由字符串列表构建 BulkString 数组，命令参数和 LRANGE 之类的结果都用这个
     */
    public static RedisArray of(List<String> items) {
        RedisMessage[] result = new RedisMessage[items.size()];
        for (int i = 0; i < items.size(); i++) {
            result[i] = new BulkString(items.get(i));
        }
        return new RedisArray(result);
    }

    public static RedisArray of(String... items) {
        return of(List.of(items));
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }
}
