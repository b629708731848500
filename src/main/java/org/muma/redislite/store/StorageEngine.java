package org.muma.redislite.store;

import org.muma.redislite.common.RedisDataType;
import org.muma.redislite.common.StreamEntry;
import org.muma.redislite.common.StreamId;

import java.util.List;

/**
 * Keyspace 存储引擎
 * <p>
 * 所有实现都必须是线程安全的：每个客户端连接有自己的工作线程，并发访问同一个实例。
 * 读路径上 Key 不存在不是错误，返回 null 或空集合。
 */
public interface StorageEngine {

    /**
     * XREAD 不阻塞
     */
    long NO_BLOCK = -1;

    // --- String ---

    /**
     * 读取字符串，过期的 Key 在这里惰性删除
     *
     * @return 值；不存在或已过期返回 null
     */
    String get(String key);

    /**
     * 写入字符串
     *
     * @return 写入前的旧值 (SET ... GET 使用)，没有则为 null
     * @throws org.muma.redislite.exception.CannotInsertException NX/XX 条件不满足，或两者同时给出
     */
    String set(String key, String value, SetOptions options);

    /**
     * INCR，保留原有 TTL
     */
    long incr(String key);

    // --- List ---

    int rpush(String list, List<String> values);

    /**
     * 逐个头插，最后一个参数最终在表头
     */
    int lpush(String list, List<String> values);

    int llen(String list);

    List<String> lrange(String list, long start, long stop);

    /**
     * @return 弹出的元素 (可能少于 count)；列表不存在或为空返回 null
     */
    List<String> lpop(String list, int count);

    List<String> rpop(String list, int count);

    /**
     * Push 之后把新元素派发给阻塞的 BLPOP (push 方法内部已经调用)
     */
    void didUpdateList(String list);

    /**
     * 阻塞式左弹出
     *
     * @param timeoutSeconds <= 0 表示无限等待
     * @return 超时返回 null
     */
    PoppedItem blpop(List<String> lists, int callerId, double timeoutSeconds);

    // --- Stream ---

    /**
     * @param id "T-S" / "T-*" / "*"
     * @return 实际写入的 ID
     */
    StreamId xadd(String stream, String id, List<String> fields);

    /**
     * @param start "-" / "T" / "T-S"
     * @param end   "+" / "T" / "T-S"
     * @param count <= 0 表示不限
     */
    List<StreamEntry> xrange(String stream, String start, String end, boolean startInclusive, int count);

    /**
     * @param starts  与 streams 一一对应，"$" 表示调用时的最后一个 ID
     * @param blockMs {@link #NO_BLOCK} 不阻塞，0 无限等待
     * @return 有新数据的 Stream，没有数据的 Stream 不出现在结果里
     */
    List<StreamReadResult> xread(List<String> streams, List<String> starts, long blockMs, int count);

    // --- Keyspace ---

    boolean hasString(String key);

    boolean hasList(String key);

    boolean hasStream(String key);

    /**
     * @return Key 的类型，不存在返回 null
     */
    RedisDataType type(String key);

    /**
     * 清空整个 Keyspace (Slave 全量同步时在应用快照前调用)。
     * 阻塞中的 BLPOP / XREAD 不受影响，继续等待。
     */
    void flushAll();
}
