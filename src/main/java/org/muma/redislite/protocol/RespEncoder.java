package org.muma.redislite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] MINUS_ONE = "-1".getBytes(StandardCharsets.UTF_8);

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        writeMessage(out, msg);
    }

    /**
     * 递归写入，数组元素可以是任意 RESP 类型 (XRANGE 返回的就是嵌套数组)
     */
    public static void writeMessage(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeBytes(s.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeBytes(e.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            out.writeBytes(String.valueOf(i.value()).getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.content() == null) {
                out.writeBytes(MINUS_ONE);
                out.writeBytes(CRLF);
            } else {
                out.writeBytes(String.valueOf(b.content().length).getBytes(StandardCharsets.UTF_8));
                out.writeBytes(CRLF);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.elements() == null) {
                out.writeBytes(MINUS_ONE);
                out.writeBytes(CRLF);
            } else {
                out.writeBytes(String.valueOf(a.elements().length).getBytes(StandardCharsets.UTF_8));
                out.writeBytes(CRLF);
                for (RedisMessage element : a.elements()) {
                    writeMessage(out, element);
                }
            }
        }
    }
}
