package org.muma.redislite.store.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.redislite.common.RedisDataType;
import org.muma.redislite.common.StreamEntry;
import org.muma.redislite.common.StreamId;
import org.muma.redislite.exception.StreamIdException;
import org.muma.redislite.exception.WrongTypeException;
import org.muma.redislite.store.SetOptions;
import org.muma.redislite.store.StorageEngine;
import org.muma.redislite.store.StreamReadResult;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageEngineStreamTest {

    private AtomicLong now;
    private MemoryStorageEngine storage;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_526_919_030_474L);
        storage = new MemoryStorageEngine(now::get);
    }

    private static List<String> ids(List<StreamEntry> entries) {
        return entries.stream().map(e -> e.id().toString()).toList();
    }

    // --- ID 生成 ---

    @Test
    void testExplicitIdMustIncrease() {
        assertEquals(new StreamId(1, 1), storage.xadd("s", "1-1", List.of("f", "v")));
        assertEquals(new StreamId(1, 2), storage.xadd("s", "1-2", List.of("f", "v")));

        StreamIdException equal = assertThrows(StreamIdException.class, () -> storage.xadd("s", "1-2", List.of("f", "v")));
        assertEquals(StreamIdException.NOT_GREATER_THAN_TOP, equal.getMessage());
        assertThrows(StreamIdException.class, () -> storage.xadd("s", "0-5", List.of("f", "v")));
    }

    @Test
    void testZeroIdAlwaysRejected() {
        StreamIdException ex = assertThrows(StreamIdException.class, () -> storage.xadd("s", "0-0", List.of("f", "v")));
        assertEquals(StreamIdException.NOT_GREATER_THAN_ZERO, ex.getMessage());
        assertNull(storage.type("s"), "Failed XADD must not create the stream");
    }

    @Test
    void testAutoSequence() {
        assertEquals("0-1", storage.generateId(null, "0-*").toString());
        assertEquals("5-0", storage.generateId(null, "5-*").toString());
        assertEquals("5-4", storage.generateId(new StreamId(5, 3), "5-*").toString());
        assertEquals("6-0", storage.generateId(new StreamId(5, 3), "6-*").toString());
        assertThrows(StreamIdException.class, () -> storage.generateId(new StreamId(5, 3), "4-*"));
    }

    @Test
    void testFullAutoId() {
        assertEquals(new StreamId(now.get(), 0), storage.generateId(null, "*"));

        // 有上一条：沿用它的时间，序号 +1，与当前时钟无关
        StreamId last = new StreamId(now.get(), 7);
        assertEquals(new StreamId(now.get(), 8), storage.generateId(last, "*"));

        now.addAndGet(5);
        assertEquals(new StreamId(last.time(), 8), storage.generateId(last, "*"));
    }

    @Test
    void testAutoIdAfterClockAdvance() {
        long start = now.get();
        StreamId first = storage.xadd("s", "*", List.of("f", "1"));
        now.addAndGet(5);
        StreamId second = storage.xadd("s", "*", List.of("f", "2"));

        assertEquals(new StreamId(start, 0), first);
        assertEquals(new StreamId(start, 1), second);
    }

    @Test
    void testMalformedId() {
        assertThrows(StreamIdException.class, () -> storage.xadd("s", "abc", List.of("f", "v")));
        assertThrows(StreamIdException.class, () -> storage.xadd("s", "12", List.of("f", "v")));
    }

    // --- XRANGE ---

    @Test
    void testXrange() {
        storage.xadd("s", "1-1", List.of("a", "1"));
        storage.xadd("s", "1-2", List.of("a", "2"));
        storage.xadd("s", "2-0", List.of("a", "3"));
        storage.xadd("s", "3-5", List.of("a", "4"));

        assertEquals(List.of("1-1", "1-2", "2-0", "3-5"), ids(storage.xrange("s", "-", "+", true, 0)));
        // 不带序号: start 补 0，end 补最大
        assertEquals(List.of("1-1", "1-2", "2-0"), ids(storage.xrange("s", "1", "2", true, 0)));
        assertEquals(List.of("1-2", "2-0"), ids(storage.xrange("s", "1-1", "2", false, 0)));
        assertEquals(List.of("1-1", "1-2"), ids(storage.xrange("s", "-", "+", true, 2)));
        assertEquals(List.of(), ids(storage.xrange("s", "3", "1", true, 0)));
        assertEquals(List.of(), ids(storage.xrange("missing", "-", "+", true, 0)));
    }

    @Test
    void testEntryKeepsFieldOrder() {
        storage.xadd("s", "1-1", List.of("b", "2", "a", "1", "b", "3"));
        StreamEntry entry = storage.xrange("s", "-", "+", true, 0).get(0);
        assertEquals(List.of("b", "2", "a", "1", "b", "3"), entry.fields());
    }

    @Test
    void testStreamTypeIsExclusive() {
        storage.xadd("s", "1-1", List.of("a", "1"));
        assertEquals(RedisDataType.STREAM, storage.type("s"));
        assertThrows(WrongTypeException.class, () -> storage.get("s"));

        storage.set("str", "v", SetOptions.NONE);
        assertThrows(WrongTypeException.class, () -> storage.xadd("str", "1-1", List.of("a", "1")));
    }

    // --- XREAD ---

    @Test
    void testXreadNonBlocking() {
        storage.xadd("s1", "1-1", List.of("a", "1"));
        storage.xadd("s1", "1-2", List.of("a", "2"));
        storage.xadd("s2", "5-0", List.of("b", "1"));

        List<StreamReadResult> result = storage.xread(List.of("s1", "s2"), List.of("1-1", "5-0"), StorageEngine.NO_BLOCK, 0);

        // s2 没有更新的记录，不出现在结果里
        assertEquals(1, result.size());
        assertEquals("s1", result.get(0).stream());
        assertEquals(List.of("1-2"), ids(result.get(0).entries()));
    }

    @Test
    void testXreadCount() {
        storage.xadd("s", "1-1", List.of("a", "1"));
        storage.xadd("s", "1-2", List.of("a", "2"));
        storage.xadd("s", "1-3", List.of("a", "3"));

        List<StreamReadResult> result = storage.xread(List.of("s"), List.of("0-0"), StorageEngine.NO_BLOCK, 2);
        assertEquals(List.of("1-1", "1-2"), ids(result.get(0).entries()));
    }

    @Test
    void testXreadUnbalanced() {
        assertThrows(IllegalArgumentException.class,
                () -> storage.xread(List.of("a", "b"), List.of("0"), StorageEngine.NO_BLOCK, 0));
    }

    @Test
    void testXreadBlockTimesOutEmpty() {
        long start = System.nanoTime();
        List<StreamReadResult> result = storage.xread(List.of("s"), List.of("0-0"), 100, 0);
        assertTrue(result.isEmpty());
        assertTrue((System.nanoTime() - start) / 1_000_000 >= 90);
    }

    @Test
    void testXreadBlockWokenByXadd() throws Exception {
        storage.xadd("s", "1-1", List.of("old", "1"));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            // $ = 调用时的最后一个 ID，旧记录不返回
            Future<List<StreamReadResult>> reader = pool.submit(
                    () -> storage.xread(List.of("s"), List.of("$"), 0, 0));

            Thread.sleep(100);
            assertFalse(reader.isDone());

            storage.xadd("s", "2-0", List.of("new", "1"));

            List<StreamReadResult> result = reader.get(2, TimeUnit.SECONDS);
            assertEquals(1, result.size());
            assertEquals(List.of("2-0"), ids(result.get(0).entries()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testXreadBlockReturnsImmediatelyWhenDataReady() {
        storage.xadd("s", "1-1", List.of("a", "1"));

        List<StreamReadResult> result = storage.xread(List.of("s"), List.of("0-0"), 0, 0);
        assertEquals(List.of("1-1"), ids(result.get(0).entries()));
    }
}
