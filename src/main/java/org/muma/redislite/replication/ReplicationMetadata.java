package org.muma.redislite.replication;

import lombok.Getter;
import lombok.Setter;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 复制元数据
 * Master 和 Slave 都需要维护
 */
public class ReplicationMetadata {

    // 自身 ReplId，40 字节十六进制
    @Getter
    private final String myReplId;

    // Master: 已产生的复制字节数; Slave: FULLRESYNC 时 Master 告知的偏移量
    private final AtomicLong replOffset = new AtomicLong(0);

    // 缓存的 Master ReplId (Slave 模式下记录，PSYNC 时带上)
    @Setter
    @Getter
    private volatile String cachedMasterReplId = "?";

    public ReplicationMetadata() {
        // 两个 UUID 去掉横杠拼出 40 位
        this.myReplId = (UUID.randomUUID().toString().replace("-", "")
                + UUID.randomUUID().toString().replace("-", "")).substring(0, 40);
    }

    public long getReplOffset() {
        return replOffset.get();
    }

    public void addOffset(long delta) {
        replOffset.addAndGet(delta);
    }

    public void setReplOffset(long offset) {
        replOffset.set(offset);
    }
}
