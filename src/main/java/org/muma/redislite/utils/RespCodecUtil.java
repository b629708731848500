package org.muma.redislite.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.muma.redislite.protocol.BulkString;
import org.muma.redislite.protocol.ProtocolException;
import org.muma.redislite.protocol.RedisArray;
import org.muma.redislite.protocol.RedisMessage;
import org.muma.redislite.protocol.RespDecoder;
import org.muma.redislite.protocol.RespEncoder;

import java.util.ArrayList;
import java.util.List;

/**
 * RESP 协议编解码工具类
 * 复制积压日志需要命令的字节形式 (用于计算偏移量)，测试里也直接用它做编码/解码。
 */
public class RespCodecUtil {

    private RespCodecUtil() {
    }

    public static byte[] encode(RedisMessage message) {
        ByteBuf buf = Unpooled.buffer(256);
        try {
            RespEncoder.writeMessage(buf, message);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * 解析一段字节里连续的多个报文；结尾不完整的部分视为错误。
     */
    public static List<RedisMessage> decodeAll(byte[] bytes) {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        List<RedisMessage> result = new ArrayList<>();
        while (buf.isReadable()) {
            RedisMessage msg = RespDecoder.readMessage(buf);
            if (msg == null) {
                throw new ProtocolException("incomplete frame");
            }
            result.add(msg);
        }
        return result;
    }

    /**
     * 把一个命令数组还原为字符串列表 (命令名 + 参数)
     */
    public static List<String> toStringList(RedisArray array) {
        List<String> result = new ArrayList<>(array.size());
        for (RedisMessage element : array.elements()) {
            if (!(element instanceof BulkString bs)) {
                throw new ProtocolException("command arguments must be bulk strings");
            }
            result.add(bs.asString());
        }
        return result;
    }
}
