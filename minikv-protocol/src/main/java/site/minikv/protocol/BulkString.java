package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.minikv.datastructure.KvBytes;

/**
 * RESP批量字符串，格式为 {@code $<len>\r\n<payload>\r\n}
 *
 * <p>内容为null的实例即协议中的Null值，编码为 {@code $-1\r\n}。
 * 负长度的批量字符串和负长度的数组都被解析为 {@link #NULL}。
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BulkString extends Resp {
    public static final BulkString NULL = new BulkString((KvBytes) null);

    private static final byte[] NULL_BYTES = "-1\r\n".getBytes(KvBytes.CHARSET);
    private static final byte[] EMPTY_BYTES = "0\r\n\r\n".getBytes(KvBytes.CHARSET);

    private final KvBytes content;

    public BulkString(final KvBytes content) {
        this.content = content;
    }

    /**
     * 复制外部字节数组构造
     */
    public BulkString(final byte[] content) {
        this.content = content == null ? null : new KvBytes(content);
    }

    /**
     * 直接包装数组，调用方保证数组之后不再被修改
     */
    static BulkString wrapTrusted(final byte[] content) {
        return new BulkString(KvBytes.wrapTrusted(content));
    }

    public static BulkString fromString(final String value) {
        return value == null ? NULL : new BulkString(KvBytes.fromString(value));
    }

    public boolean isNull() {
        return content == null;
    }

    /**
     * @return UTF-8解码后的内容，Null时返回null
     */
    public String getString() {
        return content == null ? null : content.getString();
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(BULK_STRING);
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        final int length = content.length();
        if (length == 0) {
            byteBuf.writeBytes(EMPTY_BYTES);
            return;
        }
        writeDecimal(byteBuf, length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(content.getBytesUnsafe());
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content == null ? "BulkString(null)" : "BulkString(" + content.getString() + ")";
    }
}
