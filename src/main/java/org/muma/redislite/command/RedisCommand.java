package org.muma.redislite.command;

import org.muma.redislite.exception.RedisException;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.ErrorMessage;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

public interface RedisCommand {
    // 执行命令，传入存储引擎和参数 (args[0] 是命令名)
    RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context);

    /**
     * 写命令成功后转发给 Slave 的形式
     * 默认原样转发；BLPOP、XADD 之类会改写成等价的确定性命令，返回 null 表示不转发。
     */
    default RedisArray propagation(RedisArray args, RedisMessage reply) {
        return args;
    }

    /**
     * 辅助工具：快速构建参数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    /**
     * 第 index 个参数的字符串形式 (Dispatcher 已经保证都是 BulkString)
     */
    default String arg(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).asString();
    }

    /**
     * 从 from 开始到结尾的所有参数
     */
    default List<String> argsFrom(RedisArray args, int from) {
        List<String> result = new ArrayList<>();
        for (int i = from; i < args.size(); i++) {
            result.add(arg(args, i));
        }
        return result;
    }

    default long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw RedisException.notInteger();
        }
    }
}
