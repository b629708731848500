package org.muma.redislite.server;

import lombok.Getter;
import org.muma.redislite.store.PoppedItem;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BLPOP 的等待凭证
 * <p>
 * 一次 BLPOP 只创建一个凭证，同时挂在所有候选列表的等待队列上。
 * released 是唯一的并发卫士：无论是被 Push 唤醒还是超时，谁先 CAS 成功谁说了算；
 * 一旦 released，这个凭证在任何队列里都是惰性的，扫描时直接跳过。
 */
public class WaitingTicket {

    @Getter
    private final int callerId;

    // 绝对截止时间 (毫秒)，-1 表示无限等待
    @Getter
    private final long deadline;

    private final AtomicBoolean released = new AtomicBoolean(false);

    // 结果槽 + 唤醒原语
    private final CompletableFuture<PoppedItem> result = new CompletableFuture<>();

    public WaitingTicket(int callerId, long deadline) {
        this.callerId = callerId;
        this.deadline = deadline;
    }

    /**
     * 尝试占有此凭证 (CAS)
     *
     * @return true 表示第一次释放；false 表示已经被超时或其他列表处理过
     */
    public boolean release() {
        return released.compareAndSet(false, true);
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * 写入结果并唤醒等待者。调用前必须先 {@link #release()} 成功。
     */
    public void deliver(String list, String value) {
        result.complete(new PoppedItem(list, value));
    }

    /**
     * 阻塞直到被唤醒或超时
     *
     * @param timeoutMillis <= 0 表示无限等待
     * @return 弹出的值；超时返回 null
     */
    public PoppedItem await(long timeoutMillis) {
        try {
            if (timeoutMillis > 0) {
                return result.get(timeoutMillis, TimeUnit.MILLISECONDS);
            }
            return result.get();
        } catch (TimeoutException e) {
            return onDeadline();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return onDeadline();
        } catch (ExecutionException e) {
            throw new IllegalStateException("blocking pop failed", e.getCause());
        }
    }

    private PoppedItem onDeadline() {
        if (release()) {
            // 超时先到：凭证作废，不会再收到任何值
            return null;
        }
        // 唤醒方已经抢到凭证，结果马上就会写入 (它持有存储锁，不会失败)
        return result.join();
    }
}
