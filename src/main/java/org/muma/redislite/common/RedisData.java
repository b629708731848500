package org.muma.redislite.common;

import lombok.Getter;
import lombok.Setter;
import org.muma.redislite.exception.WrongTypeException;

/**
 * Keyspace 中的一个值：类型 + 数据 + 可选过期时间
 * 一个 Key 同一时刻只对应一种类型。
 */
@Getter
public class RedisData<T> {

    // 数据类型
    private final RedisDataType type;

    // 泛型数据载体 (String 是 String, List 是 RedisList, Stream 是 RedisStream)
    private final T data;

    // 过期时间 (-1 表示不过期)，只有 STRING 会设置
    @Setter
    private long expireAt = -1;

    public RedisData(RedisDataType type, T data) {
        this.type = type;
        this.data = data;
    }

    public boolean isExpired(long now) {
        return expireAt != -1 && now >= expireAt;
    }

    /**
     * 带类型检查的取值，类型不匹配时抛 WRONGTYPE
     */
    public <V> V getValue(RedisDataType expected, Class<V> clazz) {
        if (type != expected || !clazz.isInstance(data)) {
            throw new WrongTypeException();
        }
        return clazz.cast(data);
    }
}
