package org.muma.redislite.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Redis Stream 封装类
 * 只追加；ID 严格递增由 StorageEngine 在写入前校验。
 */
public class RedisStream {

    private final NavigableMap<StreamId, StreamEntry> entries = new TreeMap<>();

    public void append(StreamEntry entry) {
        StreamId last = lastId();
        if (last != null && entry.id().compareTo(last) <= 0) {
            throw new IllegalStateException("stream id " + entry.id() + " is not greater than " + last);
        }
        entries.put(entry.id(), entry);
    }

    /**
     * 最后一条的 ID，空 Stream 返回 null
     */
    public StreamId lastId() {
        return entries.isEmpty() ? null : entries.lastKey();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * 区间查询 (XRANGE)，count <= 0 表示不限
     */
    public List<StreamEntry> range(StreamId start, boolean startInclusive, StreamId end, int count) {
        if (start.compareTo(end) > 0) return Collections.emptyList();

        List<StreamEntry> result = new ArrayList<>();
        for (StreamEntry entry : entries.subMap(start, startInclusive, end, true).values()) {
            if (count > 0 && result.size() >= count) break;
            result.add(entry);
        }
        return result;
    }

    /**
     * 严格大于 id 的条目 (XREAD)
     */
    public List<StreamEntry> after(StreamId id, int count) {
        return range(id, false, StreamId.MAX, count);
    }
}
