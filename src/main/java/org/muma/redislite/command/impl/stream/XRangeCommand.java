package org.muma.redislite.command.impl.stream;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * XRANGE key start end [COUNT count]
 * <p>
 * start 为 "-" 表示最小，end 为 "+" 表示最大；不带序号的 ID 在 start 端补 0，在 end 端补最大值。
 * start 以 "(" 开头时不包含该 ID 本身。
 */
public class XRangeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 4 && args.size() != 6) return errorArgs("xrange");

        int count = 0;
        if (args.size() == 6) {
            if (!"COUNT".equalsIgnoreCase(arg(args, 4))) throw RedisException.syntax();
            long n = parseLong(arg(args, 5));
            // COUNT 0 或负数：返回空
            if (n <= 0) return RedisArray.EMPTY;
            count = (int) Math.min(n, Integer.MAX_VALUE);
        }

        String start = arg(args, 2);
        boolean startInclusive = true;
        if (start.startsWith("(")) {
            start = start.substring(1);
            startInclusive = false;
        }

        return StreamReplies.entries(storage.xrange(arg(args, 1), start, arg(args, 3), startInclusive, count));
    }
}
