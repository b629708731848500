package org.muma.redislite.command.impl.stream;

import org.muma.redislite.common.StreamEntry;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;

import java.util.List;

/**
 * Stream 回复的公共格式: [[id, [f1, v1, ...]], ...]
 */
final class StreamReplies {

    private StreamReplies() {
    }

    static RedisArray entries(List<StreamEntry> entries) {
        RedisMessage[] result = new RedisMessage[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            StreamEntry entry = entries.get(i);
            result[i] = new RedisArray(new RedisMessage[]{
                    new BulkString(entry.id().toString()),
                    RedisArray.of(entry.fields())
            });
        }
        return new RedisArray(result);
    }
}
