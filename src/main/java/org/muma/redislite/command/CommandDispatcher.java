package org.muma.redislite.command;

import org.muma.redislite.command.impl.list.*;
import org.muma.redislite.command.impl.replication.PsyncCommand;
import org.muma.redislite.command.impl.replication.ReplConfCommand;
import org.muma.redislite.command.impl.server.EchoCommand;
import org.muma.redislite.command.impl.server.InfoCommand;
import org.muma.redislite.command.impl.server.PingCommand;
import org.muma.redislite.command.impl.server.TypeCommand;
import org.muma.redislite.command.impl.stream.XAddCommand;
import org.muma.redislite.command.impl.stream.XRangeCommand;
import org.muma.redislite.command.impl.stream.XReadCommand;
import org.muma.redislite.command.impl.string.GetCommand;
import org.muma.redislite.command.impl.string.IncrCommand;
import org.muma.redislite.command.impl.string.SetCommand;
import org.muma.redislite.command.impl.transaction.DiscardCommand;
import org.muma.redislite.command.impl.transaction.ExecCommand;
import org.muma.redislite.command.impl.transaction.MultiCommand;
import org.muma.redislite.exception.RedisException;
import org.muma.redislite.exception.UnknownCommandException;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.ErrorMessage;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.SimpleString;
import org.muma.redislite.replication.ReplicationManager;
import org.muma.redislite.server.RedisContext;
import org.muma.redislite.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 命令分发器
 * <p>
 * 所有命令都从 {@link #dispatch} 进入：事务排队 -> 查表 -> 执行 -> 写命令转发 -> 异常转错误回复。
 * 客户端连接和 Slave 的复制链路共用同一个实例，上下文由调用方提供。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final Map<CommandType, RedisCommand> commandMap = new EnumMap<>(CommandType.class);
    private final StorageEngine storage;
    private final ReplicationManager replicationManager;

    public CommandDispatcher(StorageEngine storage, ReplicationManager replicationManager) {
        this.storage = storage;
        this.replicationManager = replicationManager;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerServerCommands();
        registerStringCommands();
        registerListCommands();
        registerStreamCommands();
        registerTransactionCommands();
        registerReplicationCommands();

        for (CommandType type : CommandType.values()) {
            if (!commandMap.containsKey(type)) {
                throw new IllegalStateException("No handler registered for " + type);
            }
        }
        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerServerCommands() {
        commandMap.put(CommandType.PING, new PingCommand());
        commandMap.put(CommandType.ECHO, new EchoCommand());
        commandMap.put(CommandType.TYPE, new TypeCommand());
        commandMap.put(CommandType.INFO, new InfoCommand(replicationManager));
    }

    private void registerStringCommands() {
        commandMap.put(CommandType.GET, new GetCommand());
        commandMap.put(CommandType.SET, new SetCommand());
        commandMap.put(CommandType.INCR, new IncrCommand());
    }

    private void registerListCommands() {
        commandMap.put(CommandType.RPUSH, new RPushCommand());
        commandMap.put(CommandType.LPUSH, new LPushCommand());
        commandMap.put(CommandType.LRANGE, new LRangeCommand());
        commandMap.put(CommandType.LLEN, new LLenCommand());
        commandMap.put(CommandType.LPOP, new LPopCommand());
        commandMap.put(CommandType.RPOP, new RPopCommand());

        // blocking
        commandMap.put(CommandType.BLPOP, new BLPopCommand());
    }

    private void registerStreamCommands() {
        commandMap.put(CommandType.XADD, new XAddCommand());
        commandMap.put(CommandType.XRANGE, new XRangeCommand());
        commandMap.put(CommandType.XREAD, new XReadCommand());
    }

    private void registerTransactionCommands() {
        commandMap.put(CommandType.MULTI, new MultiCommand());
        commandMap.put(CommandType.EXEC, new ExecCommand(this));
        commandMap.put(CommandType.DISCARD, new DiscardCommand());
    }

    private void registerReplicationCommands() {
        commandMap.put(CommandType.REPLCONF, new ReplConfCommand());
        commandMap.put(CommandType.PSYNC, new PsyncCommand(replicationManager));
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(RedisArray command, RedisContext context) {
        String commandName;
        try {
            commandName = commandName(command);
        } catch (RedisException e) {
            return new ErrorMessage(e.getMessage());
        }

        Optional<CommandType> type = CommandType.lookup(commandName);

        // 事务中：除 EXEC / DISCARD / MULTI 外一律排队
        if (context.isInTransaction() && !isTransactionControl(type)) {
            context.queueCommand(command);
            return SimpleString.QUEUED;
        }

        if (type.isEmpty()) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage(new UnknownCommandException(commandName).getMessage());
        }
        return execute(type.get(), command, context);
    }

    /**
     * EXEC：依次执行排队的命令，每条命令的错误互不影响
     */
    public RedisArray executeQueued(List<RedisArray> queued, RedisContext context) {
        RedisMessage[] replies = new RedisMessage[queued.size()];
        for (int i = 0; i < queued.size(); i++) {
            RedisArray command = queued.get(i);
            String commandName = commandName(command);
            Optional<CommandType> type = CommandType.lookup(commandName);
            replies[i] = type.isPresent()
                    ? execute(type.get(), command, context)
                    : new ErrorMessage(new UnknownCommandException(commandName).getMessage());
        }
        return new RedisArray(replies);
    }

    /**
     * 执行单条命令并监控耗时。任何异常都在这里转换为错误回复，不会传到连接层。
     */
    private RedisMessage execute(CommandType type, RedisArray args, RedisContext context) {
        RedisCommand command = commandMap.get(type);

        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, args, context);

            if (type.isWrite() && !(response instanceof ErrorMessage)) {
                propagate(command, args, response);
            }

            // 记录慢日志 (阻塞命令除外)
            long duration = (System.nanoTime() - startTime) / 1000_000;
            if (duration > SLOW_COMMAND_MILLIS && !type.isBlocking()) {
                log.warn("Slow command detected: {} cost {}ms", type, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", type, duration);
            }

            return response;

        } catch (RedisException e) {
            // 协议内的错误 (WRONGTYPE、语法、ID 校验...)
            log.debug("Command {} failed: {}", type, e.getMessage());
            return new ErrorMessage(e.getMessage());

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误
            log.warn("Command execution failed (Client Error): {} - {}", type, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误 (如 NPE)
            log.error("Internal Server Error processing command: {}", type, e);
            return new ErrorMessage("ERR internal server error");
        }
    }

    // Master 才转发；Slave 执行的命令不再向下游传播
    private void propagate(RedisCommand command, RedisArray args, RedisMessage response) {
        if (replicationManager == null || !replicationManager.isMaster()) return;

        RedisArray effective = command.propagation(args, response);
        if (effective != null) {
            replicationManager.queueCommand(effective);
        }
    }

    private static boolean isTransactionControl(Optional<CommandType> type) {
        return type.isPresent()
                && (type.get() == CommandType.EXEC || type.get() == CommandType.DISCARD || type.get() == CommandType.MULTI);
    }

    /**
     * 校验命令格式：非空数组，所有元素都是非空 BulkString
     */
    private static String commandName(RedisArray command) {
        if (command == null || command.isNull() || command.size() == 0) {
            throw new RedisException("ERR Protocol error: empty command");
        }
        for (RedisMessage element : command.elements()) {
            if (!(element instanceof BulkString bs) || bs.isNull()) {
                throw new RedisException("ERR Protocol error: command arguments must be bulk strings");
            }
        }
        return ((BulkString) command.elements()[0]).asString();
    }
}
