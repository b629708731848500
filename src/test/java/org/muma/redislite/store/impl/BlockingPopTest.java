package org.muma.redislite.store.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.redislite.exception.WrongTypeException;
import org.muma.redislite.store.PoppedItem;
import org.muma.redislite.store.SetOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BlockingPopTest {

    private MemoryStorageEngine storage;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        pool = Executors.newCachedThreadPool();
    }

    // 等到指定数量的凭证登记在 list 上
    private void awaitQueued(String list, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (storage.queuedTickets(list) < expected) {
            if (System.currentTimeMillis() > deadline) {
                fail("Expected " + expected + " blocked clients on " + list);
            }
            Thread.sleep(5);
        }
    }

    @Test
    void testImmediatePopWhenDataPresent() {
        storage.rpush("l", List.of("a", "b"));

        PoppedItem item = storage.blpop(List.of("l"), 1, 1);
        assertEquals(new PoppedItem("l", "a"), item);
        assertEquals(List.of("b"), storage.lrange("l", 0, -1));
        assertEquals(0, storage.queuedTickets("l"));
    }

    @Test
    void testFirstNonEmptyListWins() {
        storage.rpush("second", List.of("x"));

        PoppedItem item = storage.blpop(List.of("first", "second"), 1, 1);
        assertEquals(new PoppedItem("second", "x"), item);
        // first 上临时登记的凭证已经撤掉
        assertEquals(0, storage.queuedTickets("first"));
    }

    @Test
    void testBlockThenWakeOnPush() throws Exception {
        Future<PoppedItem> waiter = pool.submit(() -> storage.blpop(List.of("l"), 1, 0));
        awaitQueued("l", 1);
        assertFalse(waiter.isDone());

        storage.rpush("l", List.of("hello"));

        assertEquals(new PoppedItem("l", "hello"), waiter.get(2, TimeUnit.SECONDS));
        // 值被交给等待者，列表弹空后被删除
        assertFalse(storage.hasList("l"));
    }

    @Test
    void testTimeoutReturnsNullAndDoesNotSwallowLaterPush() throws Exception {
        long start = System.nanoTime();
        PoppedItem item = storage.blpop(List.of("l"), 1, 0.1);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertNull(item);
        assertTrue(elapsedMs >= 90, "Waited only " + elapsedMs + "ms");
        assertEquals(0, storage.queuedTickets("l"));

        // 超时的凭证不会再拿走后来的值
        storage.rpush("l", List.of("v"));
        assertEquals(List.of("v"), storage.lrange("l", 0, -1));
    }

    @Test
    void testWaitersServedInFifoOrder() throws Exception {
        Future<PoppedItem> first = pool.submit(() -> storage.blpop(List.of("l"), 1, 0));
        awaitQueued("l", 1);
        Future<PoppedItem> second = pool.submit(() -> storage.blpop(List.of("l"), 2, 0));
        awaitQueued("l", 2);

        storage.rpush("l", List.of("one"));
        assertEquals("one", first.get(2, TimeUnit.SECONDS).value());
        assertFalse(second.isDone());

        storage.rpush("l", List.of("two"));
        assertEquals("two", second.get(2, TimeUnit.SECONDS).value());
    }

    @Test
    void testOnePushWakesAtMostAvailableItems() throws Exception {
        Future<PoppedItem> first = pool.submit(() -> storage.blpop(List.of("l"), 1, 0));
        awaitQueued("l", 1);
        Future<PoppedItem> second = pool.submit(() -> storage.blpop(List.of("l"), 2, 0));
        awaitQueued("l", 2);
        Future<PoppedItem> third = pool.submit(() -> storage.blpop(List.of("l"), 3, 0.3));
        awaitQueued("l", 3);

        storage.rpush("l", List.of("a", "b"));

        assertEquals("a", first.get(2, TimeUnit.SECONDS).value());
        assertEquals("b", second.get(2, TimeUnit.SECONDS).value());
        assertNull(third.get(2, TimeUnit.SECONDS));
    }

    @Test
    void testWaiterOnTwoListsGetsExactlyOneValue() throws Exception {
        Future<PoppedItem> waiter = pool.submit(() -> storage.blpop(List.of("a", "b"), 1, 0));
        awaitQueued("a", 1);
        awaitQueued("b", 1);

        storage.rpush("b", List.of("from-b"));
        assertEquals(new PoppedItem("b", "from-b"), waiter.get(2, TimeUnit.SECONDS));

        // 凭证已经用掉：a 上的 push 留在列表里
        storage.rpush("a", List.of("kept"));
        assertEquals(List.of("kept"), storage.lrange("a", 0, -1));
    }

    @Test
    void testWrongTypeFailsBeforeRegistering() {
        storage.set("s", "v", SetOptions.NONE);

        assertThrows(WrongTypeException.class, () -> storage.blpop(List.of("empty", "s"), 1, 0.05));
        assertEquals(0, storage.queuedTickets("empty"));
    }

    @Test
    void testConcurrentProducersAndBlockingConsumersDeliverEachValueOnce() throws Exception {
        int producers = 4;
        int perProducer = 250;
        int consumers = 6;
        int total = producers * perProducer;

        ConcurrentLinkedQueue<String> received = new ConcurrentLinkedQueue<>();
        CountDownLatch done = new CountDownLatch(total);
        List<Future<?>> futures = new ArrayList<>();

        for (int c = 0; c < consumers; c++) {
            int id = c;
            futures.add(pool.submit(() -> {
                while (done.getCount() > 0) {
                    PoppedItem item = storage.blpop(List.of("jobs"), id, 0.05);
                    if (item != null) {
                        received.add(item.value());
                        done.countDown();
                    }
                }
            }));
        }

        List<String> pushed = Collections.synchronizedList(new ArrayList<>());
        for (int p = 0; p < producers; p++) {
            int producer = p;
            futures.add(pool.submit(() -> {
                for (int i = 0; i < perProducer; i++) {
                    String value = producer + ":" + i;
                    pushed.add(value);
                    if (i % 2 == 0) {
                        storage.rpush("jobs", List.of(value));
                    } else {
                        storage.lpush("jobs", List.of(value));
                    }
                }
            }));
        }

        assertTrue(done.await(10, TimeUnit.SECONDS), "Not all values were consumed");
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }

        List<String> expected = new ArrayList<>(pushed);
        List<String> actual = new ArrayList<>(received);
        Collections.sort(expected);
        Collections.sort(actual);
        assertEquals(expected, actual);
        assertEquals(0, storage.llen("jobs"));
    }
}
