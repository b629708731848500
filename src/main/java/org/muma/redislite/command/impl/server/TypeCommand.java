package org.muma.redislite.command.impl.server;

import org.muma.redislite.command.RedisCommand;
import org.muma.redislite.common.RedisDataType;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

/**
 * TYPE key
 * 依次探测 string -> list -> stream，都不是返回 none
 */
public class TypeCommand implements RedisCommand {

    private static final SimpleString NONE = new SimpleString("none");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("type");

        String key = arg(args, 1);
        if (storage.hasString(key)) return new SimpleString(RedisDataType.STRING.typeName());
        if (storage.hasList(key)) return new SimpleString(RedisDataType.LIST.typeName());
        if (storage.hasStream(key)) return new SimpleString(RedisDataType.STREAM.typeName());
        return NONE;
    }
}
