package org.muma.redislite.command.impl.stream;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;
import org.muma.redislite.store.StreamReadResult;

import java.util.List;
import java.util.Locale;

/**
 * XREAD [COUNT count] [BLOCK milliseconds] STREAMS key [key ...] id [id ...]
 * <p>
 * 只返回严格大于给定 id 的记录；"$" 表示调用时 Stream 的最后一个 id。
 * BLOCK 0 无限等待；没有任何数据时返回 nil 数组。
 */
public class XReadCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 4) return errorArgs("xread");

        int count = 0;
        long blockMs = StorageEngine.NO_BLOCK;
        int i = 1;
        int streamsAt = -1;
        while (i < args.size()) {
            String opt = arg(args, i).toUpperCase(Locale.ROOT);
            if ("STREAMS".equals(opt)) {
                streamsAt = i + 1;
                break;
            }
            if (i + 1 >= args.size()) throw RedisException.syntax();
            switch (opt) {
                case "COUNT" -> {
                    long n = parseLong(arg(args, i + 1));
                    count = n <= 0 ? 0 : (int) Math.min(n, Integer.MAX_VALUE);
                }
                case "BLOCK" -> {
                    blockMs = parseLong(arg(args, i + 1));
                    if (blockMs < 0) throw new RedisException("ERR timeout is negative");
                }
                default -> throw RedisException.syntax();
            }
            i += 2;
        }
        if (streamsAt < 0) throw RedisException.syntax();

        int remaining = args.size() - streamsAt;
        if (remaining == 0 || remaining % 2 != 0) {
            throw new RedisException("ERR Unbalanced 'xread' list of streams: for each stream key an ID must be specified.");
        }
        List<String> rest = argsFrom(args, streamsAt);
        List<String> streams = rest.subList(0, remaining / 2);
        List<String> ids = rest.subList(remaining / 2, remaining);

        List<StreamReadResult> results = storage.xread(streams, ids, blockMs, count);
        if (results.isEmpty()) {
            return RedisArray.NULL;
        }

        RedisMessage[] reply = new RedisMessage[results.size()];
        for (int k = 0; k < results.size(); k++) {
            StreamReadResult result = results.get(k);
            reply[k] = new RedisArray(new RedisMessage[]{
                    new BulkString(result.stream()),
                    StreamReplies.entries(result.entries())
            });
        }
        return new RedisArray(reply);
    }
}
