package org.muma.redislite.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * 全局阻塞请求管理器
 * 负责 BLPOP 凭证队列和 XREAD BLOCK 等待者的登记与唤醒。
 * <p>
 * 本类不做同步：所有方法都必须在 StorageEngine 的 keyspace 锁内调用，
 * 这样 "检查列表 -> 登记凭证" 和 "Push -> 派发" 是同一个临界区，不会丢值。
 */
public class BlockingManager {

    private static final Logger log = LoggerFactory.getLogger(BlockingManager.class);

    // List -> 等待该 List 的凭证 (FIFO，按登记顺序)
    private final Map<String, Deque<WaitingTicket>> waitingTickets = new HashMap<>();

    // 正在派发中的 List，防止同一个 List 的派发重入
    private final Set<String> drainsInProgress = new HashSet<>();

    // Stream -> 阻塞在该 Stream 上的 XREAD
    private final Map<String, Set<StreamWaiter>> streamWaiters = new HashMap<>();

    // =========================================================
    // List
    // =========================================================

    /**
     * 该 List 上是否还有未释放的凭证
     */
    public boolean hasActiveTickets(String list) {
        Deque<WaitingTicket> queue = waitingTickets.get(list);
        if (queue == null) return false;
        for (WaitingTicket ticket : queue) {
            if (!ticket.isReleased()) return true;
        }
        return false;
    }

    /**
     * 把凭证排到 List 等待队列的队尾
     */
    public void enqueue(String list, WaitingTicket ticket) {
        waitingTickets.computeIfAbsent(list, k -> new ArrayDeque<>()).addLast(ticket);
        log.debug("Client {} blocked on list: {}", ticket.getCallerId(), list);
    }

    /**
     * 把凭证从它登记过的所有队列里摘掉 (超时或者直接弹出成功之后)
     */
    public void forget(WaitingTicket ticket, List<String> lists) {
        for (String list : lists) {
            Deque<WaitingTicket> queue = waitingTickets.get(list);
            if (queue == null) continue;
            queue.remove(ticket);
            if (queue.isEmpty()) {
                waitingTickets.remove(list);
            }
        }
    }

    /**
     * Push 之后的派发 (Drain)
     * <p>
     * 按 FIFO 把新元素逐个交给仍然有效的凭证；已经释放的凭证直接出队。
     * 每个元素只会交给一个凭证，凭证先 CAS 再弹出，所以超时和唤醒同时发生时不会丢值。
     *
     * @param available 列表当前长度
     * @param popper    从列表头部弹出一个元素
     */
    public void drain(String list, IntSupplier available, Supplier<String> popper) {
        Deque<WaitingTicket> queue = waitingTickets.get(list);
        if (queue == null || queue.isEmpty()) return;
        if (available.getAsInt() <= 0) return;

        if (!drainsInProgress.add(list)) return;
        try {
            while (available.getAsInt() > 0) {
                WaitingTicket ticket = queue.peekFirst();
                if (ticket == null) break;

                if (!ticket.release()) {
                    // 已超时，或已经在别的 List 上拿到值
                    queue.pollFirst();
                    continue;
                }

                String value = popper.get();
                ticket.deliver(list, value);
                queue.pollFirst();
                log.debug("Client {} unblocked on list: {}", ticket.getCallerId(), list);
            }
            if (queue.isEmpty()) {
                waitingTickets.remove(list);
            }
        } finally {
            drainsInProgress.remove(list);
        }
    }

    /**
     * 等待该 List 的凭证数量 (含已释放但还未清理的)
     */
    public int queuedTickets(String list) {
        Deque<WaitingTicket> queue = waitingTickets.get(list);
        return queue == null ? 0 : queue.size();
    }

    // =========================================================
    // Stream
    // =========================================================

    public void addStreamWaiter(String stream, StreamWaiter waiter) {
        streamWaiters.computeIfAbsent(stream, k -> new LinkedHashSet<>()).add(waiter);
    }

    public void removeStreamWaiter(StreamWaiter waiter, List<String> streams) {
        for (String stream : streams) {
            Set<StreamWaiter> waiters = streamWaiters.get(stream);
            if (waiters == null) continue;
            waiters.remove(waiter);
            if (waiters.isEmpty()) {
                streamWaiters.remove(stream);
            }
        }
    }

    /**
     * XADD 之后唤醒该 Stream 上的所有等待者
     */
    public void signalStream(String stream) {
        Set<StreamWaiter> waiters = streamWaiters.remove(stream);
        if (waiters == null) return;

        waiters.forEach(StreamWaiter::wake);
        log.debug("Woke {} readers blocked on stream: {}", waiters.size(), stream);
    }
}
