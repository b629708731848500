package org.muma.redislite.server;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * XREAD BLOCK 的唤醒原语，同一次调用在多个 Stream 上共享一个
 */
public class StreamWaiter {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    public void wake() {
        signal.complete(null);
    }

    /**
     * @param blockMillis 0 表示无限等待
     * @return true 被 XADD 唤醒；false 超时
     */
    public boolean await(long blockMillis) {
        try {
            if (blockMillis > 0) {
                signal.get(blockMillis, TimeUnit.MILLISECONDS);
            } else {
                signal.get();
            }
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("stream wait failed", e.getCause());
        }
    }
}
