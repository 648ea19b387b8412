package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * RESP整数，格式为 {@code :<n>\r\n}
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class RespInteger extends Resp {
    private static final RespInteger[] CACHE = new RespInteger[256];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i);
        }
    }

    private final long content;

    public RespInteger(final long content) {
        this.content = content;
    }

    public static RespInteger valueOf(final long value) {
        if (value >= 0 && value < CACHE.length) {
            return CACHE[(int) value];
        }
        return new RespInteger(value);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(INTEGER);
        writeDecimal(byteBuf, content);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "RespInteger(" + content + ")";
    }
}
