package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RespEncoder测试")
class RespEncoderTest {

    private static String writeAndRead(final Resp resp) {
        final EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        channel.writeOutbound(resp);
        final ByteBuf out = channel.readOutbound();
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
            channel.finish();
        }
    }

    @Test
    @DisplayName("简单字符串")
    void simpleString() {
        assertThat(writeAndRead(SimpleString.OK)).isEqualTo("+OK\r\n");
    }

    @Test
    @DisplayName("Null批量字符串")
    void nullBulk() {
        assertThat(writeAndRead(BulkString.NULL)).isEqualTo("$-1\r\n");
    }

    @Test
    @DisplayName("数组")
    void array() {
        final RespArray array = new RespArray(new Resp[]{BulkString.fromString("f"), BulkString.fromString("v")});
        assertThat(writeAndRead(array)).isEqualTo("*2\r\n$1\r\nf\r\n$1\r\nv\r\n");
    }
}
