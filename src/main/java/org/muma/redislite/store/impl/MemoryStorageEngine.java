package org.muma.redislite.store.impl;

import org.muma.redislite.common.RedisData;
import org.muma.redislite.common.RedisDataType;
import org.muma.redislite.common.RedisList;
import org.muma.redislite.common.RedisStream;
import org.muma.redislite.common.StreamEntry;
import org.muma.redislite.common.StreamId;
import org.muma.redislite.exception.CannotInsertException;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.exception.StreamIdException;
import org.muma.redislite.exception.WrongTypeException;
import org.muma.redislite.server.BlockingManager;
import org.muma.redislite.server.StreamWaiter;
import org.muma.redislite.server.WaitingTicket;
import org.muma.redislite.store.PoppedItem;
import org.muma.redislite.store.SetOptions;
import org.muma.redislite.store.StorageEngine;
import org.muma.redislite.store.StreamReadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * 内存存储引擎
 * <p>
 * 一把 keyspace 锁保护所有数据结构和阻塞队列；阻塞等待 (BLPOP / XREAD BLOCK) 发生在锁外。
 * 过期只做惰性删除：访问到过期 Key 时才清理，没有后台扫描。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    private final Object lock = new Object();

    // Key -> Data，一个 Key 只对应一种类型
    private final Map<String, RedisData<?>> memoryDb = new HashMap<>();

    private final BlockingManager blockingManager = new BlockingManager();

    // 毫秒时钟，测试中可替换
    private final LongSupplier clock;

    public MemoryStorageEngine() {
        this(System::currentTimeMillis);
    }

    public MemoryStorageEngine(LongSupplier clock) {
        this.clock = clock;
    }

    // =========================================================
    // Keyspace 基础
    // =========================================================

    /**
     * 惰性删除 (Lazy Expiration)，调用方持有锁
     */
    private RedisData<?> lookup(String key) {
        RedisData<?> data = memoryDb.get(key);
        if (data == null) return null;
        if (data.isExpired(clock.getAsLong())) {
            memoryDb.remove(key);
            log.debug("Key expired: {}", key);
            return null;
        }
        return data;
    }

    private RedisList lookupList(String key) {
        RedisData<?> data = lookup(key);
        return data == null ? null : data.getValue(RedisDataType.LIST, RedisList.class);
    }

    private RedisList getOrCreateList(String key) {
        RedisList list = lookupList(key);
        if (list == null) {
            list = new RedisList();
            memoryDb.put(key, new RedisData<>(RedisDataType.LIST, list));
        }
        return list;
    }

    private RedisStream lookupStream(String key) {
        RedisData<?> data = lookup(key);
        return data == null ? null : data.getValue(RedisDataType.STREAM, RedisStream.class);
    }

    @Override
    public boolean hasString(String key) {
        return type(key) == RedisDataType.STRING;
    }

    @Override
    public boolean hasList(String key) {
        return type(key) == RedisDataType.LIST;
    }

    @Override
    public boolean hasStream(String key) {
        return type(key) == RedisDataType.STREAM;
    }

    @Override
    public RedisDataType type(String key) {
        synchronized (lock) {
            RedisData<?> data = lookup(key);
            return data == null ? null : data.getType();
        }
    }

    @Override
    public void flushAll() {
        synchronized (lock) {
            int size = memoryDb.size();
            memoryDb.clear();
            log.info("Keyspace flushed, {} keys removed", size);
        }
    }

    // =========================================================
    // String
    // =========================================================

    @Override
    public String get(String key) {
        synchronized (lock) {
            RedisData<?> data = lookup(key);
            return data == null ? null : data.getValue(RedisDataType.STRING, String.class);
        }
    }

    @Override
    public String set(String key, String value, SetOptions options) {
        synchronized (lock) {
            if (options.onlyIfExists() && options.onlyIfNotExists()) {
                throw new CannotInsertException(key);
            }

            RedisData<?> existing = lookup(key);
            if (options.onlyIfExists() && existing == null) {
                throw new CannotInsertException(key);
            }
            if (options.onlyIfNotExists() && existing != null) {
                throw new CannotInsertException(key);
            }

            boolean wasString = existing != null && existing.getType() == RedisDataType.STRING;
            String previous = wasString ? (String) existing.getData() : null;

            RedisData<String> newData = new RedisData<>(RedisDataType.STRING, value);
            SetOptions.Ttl ttl = options.ttl();
            if (ttl == null) {
                // 没有 TTL 参数：清除旧的过期时间
                newData.setExpireAt(-1);
            } else if (ttl.kind() == SetOptions.TtlKind.KEEPTTL) {
                newData.setExpireAt(wasString ? existing.getExpireAt() : -1);
            } else {
                newData.setExpireAt(ttl.resolveExpireAt(clock.getAsLong()));
            }

            memoryDb.put(key, newData);
            return previous;
        }
    }

    @Override
    public long incr(String key) {
        synchronized (lock) {
            RedisData<?> data = lookup(key);
            long val = 0;
            if (data != null) {
                try {
                    val = Long.parseLong(data.getValue(RedisDataType.STRING, String.class));
                } catch (NumberFormatException e) {
                    throw RedisException.notInteger();
                }
            }
            if (val == Long.MAX_VALUE) {
                throw new RedisException("ERR increment or decrement would overflow");
            }
            val++;

            RedisData<String> newData = new RedisData<>(RedisDataType.STRING, String.valueOf(val));
            // INCR 不会清除 TTL
            if (data != null) {
                newData.setExpireAt(data.getExpireAt());
            }
            memoryDb.put(key, newData);
            return val;
        }
    }

    // =========================================================
    // List
    // =========================================================

    @Override
    public int rpush(String list, List<String> values) {
        synchronized (lock) {
            RedisList target = getOrCreateList(list);
            for (String value : values) {
                target.rpush(value);
            }
            int length = target.size();
            didUpdateList(list);
            return length;
        }
    }

    @Override
    public int lpush(String list, List<String> values) {
        synchronized (lock) {
            RedisList target = getOrCreateList(list);
            // LPUSH mylist a b c -> c, b, a
            for (String value : values) {
                target.lpush(value);
            }
            int length = target.size();
            didUpdateList(list);
            return length;
        }
    }

    @Override
    public int llen(String list) {
        synchronized (lock) {
            RedisList target = lookupList(list);
            return target == null ? 0 : target.size();
        }
    }

    @Override
    public List<String> lrange(String list, long start, long stop) {
        synchronized (lock) {
            RedisList target = lookupList(list);
            return target == null ? Collections.emptyList() : target.range(start, stop);
        }
    }

    @Override
    public List<String> lpop(String list, int count) {
        return pop(list, count, true);
    }

    @Override
    public List<String> rpop(String list, int count) {
        return pop(list, count, false);
    }

    private List<String> pop(String list, int count, boolean left) {
        synchronized (lock) {
            RedisList target = lookupList(list);
            if (target == null || target.isEmpty()) return null;

            List<String> popped = new ArrayList<>();
            for (int i = 0; i < count && !target.isEmpty(); i++) {
                popped.add(left ? target.lpop() : target.rpop());
            }
            removeIfEmpty(list, target);
            return popped;
        }
    }

    // 列表弹空后从 keyspace 移除
    private void removeIfEmpty(String key, RedisList list) {
        if (list.isEmpty()) {
            memoryDb.remove(key);
        }
    }

    @Override
    public void didUpdateList(String list) {
        synchronized (lock) {
            RedisList target = lookupList(list);
            if (target == null) return;

            blockingManager.drain(list, target::size, target::lpop);
            removeIfEmpty(list, target);
        }
    }

    @Override
    public PoppedItem blpop(List<String> lists, int callerId, double timeoutSeconds) {
        long timeoutMillis = timeoutSeconds > 0 ? Math.max(1, Math.round(timeoutSeconds * 1000)) : 0;
        long deadline = timeoutMillis > 0 ? clock.getAsLong() + timeoutMillis : -1;
        WaitingTicket ticket = new WaitingTicket(callerId, deadline);

        // 一次加锁覆盖所有候选列表：检查和登记之间不会有 Push 插进来
        synchronized (lock) {
            // 先校验类型，避免登记到一半抛异常留下悬空凭证
            for (String name : lists) {
                lookupList(name);
            }

            for (String name : lists) {
                if (!blockingManager.hasActiveTickets(name)) {
                    RedisList target = lookupList(name);
                    if (target != null && !target.isEmpty()) {
                        String value = target.lpop();
                        removeIfEmpty(name, target);
                        // 前面列表上已经登记的凭证作废
                        ticket.release();
                        blockingManager.forget(ticket, lists);
                        return new PoppedItem(name, value);
                    }
                }
                blockingManager.enqueue(name, ticket);
            }
        }

        PoppedItem result = ticket.await(timeoutMillis);
        if (result == null) {
            synchronized (lock) {
                blockingManager.forget(ticket, lists);
            }
            log.debug("BLPOP timed out for client {} on {}", callerId, lists);
        }
        return result;
    }

    // =========================================================
    // Stream
    // =========================================================

    @Override
    public StreamId xadd(String stream, String id, List<String> fields) {
        synchronized (lock) {
            RedisStream target = lookupStream(stream);
            StreamId newId = generateId(target == null ? null : target.lastId(), id);

            if (target == null) {
                target = new RedisStream();
                memoryDb.put(stream, new RedisData<>(RedisDataType.STREAM, target));
            }
            target.append(new StreamEntry(newId, fields));
            blockingManager.signalStream(stream);
            return newId;
        }
    }

    /**
     * 校验并生成 Stream ID
     * <ul>
     *     <li>"*": 有上一条时沿用它的时间，序号 +1；Stream 为空时取当前毫秒时间，序号 0</li>
     *     <li>"T-*": T 与上一条相同则序号 +1，否则为 0 (T 为 0 且 Stream 为空时为 1)</li>
     *     <li>"T-S": 必须严格大于上一条</li>
     * </ul>
     * 0-0 永远非法。
     */
    StreamId generateId(StreamId last, String spec) {
        StreamId id;
        if ("*".equals(spec)) {
            id = last != null
                    ? new StreamId(last.time(), last.sequence() + 1)
                    : new StreamId(clock.getAsLong(), 0);
        } else if (spec.endsWith("-*")) {
            long time = StreamId.parse(spec.substring(0, spec.length() - 2), 0).time();
            if (last != null && time == last.time()) {
                id = new StreamId(time, last.sequence() + 1);
            } else if (time == 0 && last == null) {
                id = new StreamId(0, 1);
            } else {
                id = new StreamId(time, 0);
            }
        } else {
            if (spec.indexOf('-') < 0) {
                throw new StreamIdException(StreamIdException.INVALID);
            }
            id = StreamId.parse(spec, 0);
        }

        if (id.isZero()) {
            throw new StreamIdException(StreamIdException.NOT_GREATER_THAN_ZERO);
        }
        if (last != null && id.compareTo(last) <= 0) {
            throw new StreamIdException(StreamIdException.NOT_GREATER_THAN_TOP);
        }
        return id;
    }

    @Override
    public List<StreamEntry> xrange(String stream, String start, String end, boolean startInclusive, int count) {
        StreamId from = "-".equals(start) ? StreamId.MIN : StreamId.parse(start, 0);
        StreamId to = "+".equals(end) ? StreamId.MAX : StreamId.parse(end, Long.MAX_VALUE);

        synchronized (lock) {
            RedisStream target = lookupStream(stream);
            if (target == null) return Collections.emptyList();
            return target.range(from, startInclusive, to, count);
        }
    }

    @Override
    public List<StreamReadResult> xread(List<String> streams, List<String> starts, long blockMs, int count) {
        if (streams.size() != starts.size()) {
            throw new IllegalArgumentException("Unbalanced 'xread' list of streams: for each stream key an ID must be specified.");
        }

        List<StreamId> from = new ArrayList<>(streams.size());
        StreamWaiter waiter = null;

        synchronized (lock) {
            boolean anyReady = false;
            for (int i = 0; i < streams.size(); i++) {
                RedisStream target = lookupStream(streams.get(i));
                StreamId last = target == null ? null : target.lastId();
                StreamId start = "$".equals(starts.get(i))
                        ? (last == null ? StreamId.MIN : last)
                        : StreamId.parse(starts.get(i), 0);
                from.add(start);
                if (last != null && last.compareTo(start) > 0) {
                    anyReady = true;
                }
            }

            if (blockMs != NO_BLOCK && !anyReady) {
                waiter = new StreamWaiter();
                for (String stream : streams) {
                    blockingManager.addStreamWaiter(stream, waiter);
                }
            }
        }

        if (waiter != null) {
            boolean woken = waiter.await(blockMs);
            synchronized (lock) {
                blockingManager.removeStreamWaiter(waiter, streams);
            }
            if (!woken) {
                log.debug("XREAD BLOCK timed out on {}", streams);
            }
        }

        synchronized (lock) {
            List<StreamReadResult> result = new ArrayList<>();
            for (int i = 0; i < streams.size(); i++) {
                RedisStream target = lookupStream(streams.get(i));
                if (target == null) continue;
                List<StreamEntry> entries = target.after(from.get(i), count);
                if (!entries.isEmpty()) {
                    result.add(new StreamReadResult(streams.get(i), entries));
                }
            }
            return result;
        }
    }

    /**
     * 测试/诊断用：某个 List 上排队的凭证数
     */
    int queuedTickets(String list) {
        synchronized (lock) {
            return blockingManager.queuedTickets(list);
        }
    }
}
