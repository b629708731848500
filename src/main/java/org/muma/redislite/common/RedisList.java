package org.muma.redislite.common;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Redis List 封装类
 * 底层是 ArrayDeque，两端 push/pop 都是 O(1)。
 * 不做同步，由 StorageEngine 的锁保护。
 */
public class RedisList {

    private final Deque<String> elements = new ArrayDeque<>();

    /**
     * 头部插入 (LPUSH)
     */
    public void lpush(String element) {
        elements.addFirst(element);
    }

    /**
     * 尾部插入 (RPUSH)
     */
    public void rpush(String element) {
        elements.addLast(element);
    }

    /**
     * 头部弹出 (LPOP)，空列表返回 null
     */
    public String lpop() {
        return elements.pollFirst();
    }

    /**
     * 尾部弹出 (RPOP)，空列表返回 null
     */
    public String rpop() {
        return elements.pollLast();
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * 范围查询 (LRANGE)
     * <p>
     * 负数下标从尾部计数，结果先截到 0；两端再夹到 [0, size-1]；start > stop 返回空。
     * 任何下标组合都不会抛异常。
     */
    public List<String> range(long start, long stop) {
        int size = elements.size();
        if (size == 0) return Collections.emptyList();

        if (start < 0) start = Math.max(size + start, 0);
        if (stop < 0) stop = Math.max(size + stop, 0);

        start = Math.min(size - 1, start);
        stop = Math.min(size - 1, stop);

        if (start > stop) return Collections.emptyList();

        List<String> slice = new ArrayList<>((int) (stop - start + 1));
        Iterator<String> it = elements.iterator();
        for (int index = 0; index <= stop && it.hasNext(); index++) {
            String item = it.next();
            if (index >= start) {
                slice.add(item);
            }
        }
        return slice;
    }
}
