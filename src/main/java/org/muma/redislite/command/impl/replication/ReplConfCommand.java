package org.muma.redislite.command.impl.replication;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.replication.ReplicaConnection;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

import java.util.Locale;

/**
 * REPLCONF listening-port port | capa capability | GETACK *
 * <p>
 * listening-port: 在连接上暂存一个 Slave 描述，等 PSYNC 时正式注册。
 * GETACK: Slave 回复 ACK (偏移量目前固定为 0)。
 */
public class ReplConfCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 2) return errorArgs("replconf");

        String option = arg(args, 1).toLowerCase(Locale.ROOT);
        switch (option) {
            case "listening-port" -> {
                if (args.size() != 3) return errorArgs("replconf");
                long port = parseLong(arg(args, 2));
                if (port <= 0 || port > 65535) {
                    throw new RedisException("ERR invalid listening-port " + port);
                }
                context.setPendingReplica(new ReplicaConnection(context.getRemoteAddress(), (int) port));
                return SimpleString.OK;
            }
            case "getack" -> {
                return RedisArray.of("REPLCONF", "ACK", "0");
            }
            default -> {
                // capa、ack 等其余选项只做确认
                return SimpleString.OK;
            }
        }
    }
}
