package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * RESP数组，格式为 {@code *<n>\r\n} 后接n个任意类型的元素
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class RespArray extends Resp {
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    private final Resp[] content;

    public RespArray(final Resp[] content) {
        if (content == null) {
            throw new IllegalArgumentException("数组内容不能为null，Null值请使用BulkString.NULL");
        }
        this.content = content;
    }

    public int size() {
        return content.length;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(ARRAY);
        writeDecimal(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);
        for (Resp resp : content) {
            resp.encode(byteBuf);
        }
    }

    @Override
    public String toString() {
        return "RespArray" + Arrays.toString(content);
    }
}
