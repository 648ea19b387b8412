package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP错误消息，格式为 {@code -<message>\r\n}
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Errors extends Resp {
    private final String content;

    public Errors(final String content) {
        this.content = content;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(ERROR);
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "Errors(" + content + ")";
    }
}
