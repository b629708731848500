package org.muma.redislite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * 每次尝试解析一个完整的报文；数据不完整时回滚 readerIndex，等待更多字节。
 * 遇到非法报文时丢弃当前缓冲区里剩余的字节并抛出 {@link ProtocolException}，
 * 由上层 Handler 回复错误，连接本身不会被关闭。
 */
public class RespDecoder extends ByteToMessageDecoder {

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 与 Redis 默认一致的上限，防止一个报文头就撑爆堆内存
    static final long MAX_MULTIBULK_LENGTH = 1024 * 1024;
    static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;

    // Slave 端：收到 FULLRESYNC 后，下一帧是 RDB 快照
    private boolean expectSnapshot = false;

    /**
     * 切换到快照模式，只对下一帧生效
     */
    public void expectSnapshot() {
        this.expectSnapshot = true;
    }

    /**
     * 每次只解析一帧。ByteToMessageDecoder 会在两帧之间先把结果交给下游，
     * 这样 Slave Handler 看到 FULLRESYNC 后切换的快照模式能作用到紧跟着的字节上。
     */
    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int start = in.readerIndex();
        Object decoded;
        try {
            decoded = expectSnapshot ? readSnapshot(in) : readMessage(in);
        } catch (ProtocolException e) {
            // 丢掉脏数据，重新对齐到下一次读取
            in.skipBytes(in.readableBytes());
            throw e;
        }
        if (decoded == null) {
            // 半包：回滚，等待更多数据
            in.readerIndex(start);
            return;
        }
        if (decoded instanceof RdbSnapshot) {
            expectSnapshot = false;
        }
        out.add(decoded);
    }

    /**
     * 解析一个完整的 RESP 报文
     *
     * @return 报文；数据不足时返回 null
     */
    public static RedisMessage readMessage(ByteBuf in) {
        if (!in.isReadable()) return null;

        byte type = in.readByte();
        return switch (type) {
            case PLUS_BYTE -> {
                String line = readLine(in);
                yield line == null ? null : new SimpleString(line);
            }
            case MINUS_BYTE -> {
                String line = readLine(in);
                yield line == null ? null : new ErrorMessage(line);
            }
            case COLON_BYTE -> {
                String line = readLine(in);
                yield line == null ? null : new RedisInteger(parseLength(line));
            }
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in);
            default -> throw new ProtocolException("unknown RESP type byte '" + (char) type + "'");
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private static BulkString decodeBulkString(ByteBuf in) {
        String header = readLine(in);
        if (header == null) return null;

        long length = parseLength(header);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new ProtocolException("invalid bulk length " + length);
        }
        if (in.readableBytes() < length + 2) return null;

        byte[] content = new byte[(int) length];
        in.readBytes(content);

        // 读取末尾的 CRLF
        if (in.readByte() != CR || in.readByte() != LF) {
            throw new ProtocolException("expected CRLF after bulk string");
        }
        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private static RedisArray decodeArray(ByteBuf in) {
        String header = readLine(in);
        if (header == null) return null;

        long count = parseLength(header);
        if (count == -1) {
            return RedisArray.NULL;
        }
        if (count < 0 || count > MAX_MULTIBULK_LENGTH) {
            throw new ProtocolException("invalid multibulk length " + count);
        }

        // 不按报文头声明的数量预分配，元素到齐多少放多少
        List<RedisMessage> elements = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            RedisMessage element = readMessage(in);
            if (element == null) return null;
            elements.add(element);
        }
        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    // 快照帧: $<length>\r\n<payload> (没有结尾 CRLF)
    private static RdbSnapshot readSnapshot(ByteBuf in) {
        if (!in.isReadable()) return null;
        byte type = in.readByte();
        if (type != DOLLAR_BYTE) {
            throw new ProtocolException("expected snapshot frame, got '" + (char) type + "'");
        }
        String header = readLine(in);
        if (header == null) return null;

        long length = parseLength(header);
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new ProtocolException("invalid snapshot length " + length);
        }
        if (in.readableBytes() < length) return null;

        byte[] content = new byte[(int) length];
        in.readBytes(content);
        return new RdbSnapshot(content);
    }

    // 辅助：读取一行字符串（即读取到 \r\n 为止），不完整时返回 null
    private static String readLine(ByteBuf in) {
        int lf = in.indexOf(in.readerIndex(), in.writerIndex(), LF);
        if (lf < 0) return null;
        if (lf == in.readerIndex() || in.getByte(lf - 1) != CR) {
            throw new ProtocolException("expected CRLF line terminator");
        }
        String line = in.toString(in.readerIndex(), lf - 1 - in.readerIndex(), StandardCharsets.UTF_8);
        in.readerIndex(lf + 1);
        return line;
    }

    // 辅助：解析长度/整数
    private static long parseLength(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new ProtocolException("invalid length '" + s + "'");
        }
    }
}
