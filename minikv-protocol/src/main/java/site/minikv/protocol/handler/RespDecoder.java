package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespProtocolException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>把连接上的字节流切分成一个个请求值，支持标准RESP格式和INLINE命令格式
 * （如 {@code PING\r\n}）。数据不完整时等待更多字节；格式错误时记录日志并关闭连接。
 *
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 最大内联命令长度限制 */
    private static final int MAX_INLINE_LENGTH = 64 * 1024; // 64KB

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (in.isReadable()) {
            final byte firstByte = in.getByte(in.readerIndex());

            // 1. 跳过请求之间的空行
            if (firstByte == '\n' || firstByte == '\r') {
                in.skipBytes(1);
                continue;
            }

            // 2. 判断是RESP格式还是INLINE格式
            final Resp resp;
            try {
                resp = isValidRespType(firstByte) ? Resp.decode(in) : decodeInlineCommand(in);
            } catch (RespProtocolException e) {
                log.warn("RESP协议错误，关闭连接 {}: {}", ctx.channel().remoteAddress(), e.getMessage());
                in.skipBytes(in.readableBytes());
                ctx.close();
                return;
            }

            // 3. 数据不完整，等待更多数据
            if (resp == null) {
                return;
            }
            out.add(resp);
            log.debug("成功解码RESP对象: {}", resp.getClass().getSimpleName());
            return;
        }
    }

    /**
     * 解码INLINE格式命令，行结束符可以是\r\n或单独的\n
     *
     * @param in 输入缓冲区
     * @return 解码后的命令数组，数据不完整时返回null
     */
    private Resp decodeInlineCommand(final ByteBuf in) {
        final int startIndex = in.readerIndex();
        final int newline = in.indexOf(startIndex, in.writerIndex(), (byte) '\n');
        if (newline < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                throw new RespProtocolException("INLINE命令过长");
            }
            return null;
        }

        int endIndex = newline;
        if (endIndex > startIndex && in.getByte(endIndex - 1) == '\r') {
            endIndex--;
        }
        final String commandLine = in.toString(startIndex, endIndex - startIndex, StandardCharsets.UTF_8);
        in.readerIndex(newline + 1);

        final List<BulkString> parts = new ArrayList<>(8);
        for (String part : commandLine.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                parts.add(BulkString.fromString(part));
            }
        }
        if (parts.isEmpty()) {
            return RespArray.EMPTY;
        }
        log.debug("解析INLINE命令: {}", commandLine);
        return new RespArray(parts.toArray(new Resp[0]));
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private static boolean isValidRespType(final byte b) {
        return b == Resp.SIMPLE_STRING || b == Resp.ERROR || b == Resp.INTEGER
                || b == Resp.BULK_STRING || b == Resp.ARRAY;
    }
}
