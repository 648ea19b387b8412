package site.minikv.protocol.handler;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RespDecoder测试")
class RespDecoderTest {

    private static RespArray command(final String... parts) {
        final Resp[] content = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            content[i] = BulkString.fromString(parts[i]);
        }
        return new RespArray(content);
    }

    private static void write(final EmbeddedChannel channel, final String data) {
        channel.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("一次到达的多个请求依次解码")
    void pipelinedRequests() {
        final EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        write(channel, "*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");

        assertThat((Resp) channel.readInbound()).isEqualTo(command("PING"));
        assertThat((Resp) channel.readInbound()).isEqualTo(command("GET", "k"));
        assertThat((Object) channel.readInbound()).isNull();
        channel.finish();
    }

    @Test
    @DisplayName("分片到达的请求等待完整后再解码")
    void fragmentedRequest() {
        final EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        write(channel, "*2\r\n$3\r\nGE");
        assertThat((Object) channel.readInbound()).isNull();

        write(channel, "T\r\n$1\r\nk\r\n");
        assertThat((Resp) channel.readInbound()).isEqualTo(command("GET", "k"));
        channel.finish();
    }

    @Test
    @DisplayName("INLINE命令")
    void inlineCommand() {
        final EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        write(channel, "SET  key value\r\nPING\n");

        assertThat((Resp) channel.readInbound()).isEqualTo(command("SET", "key", "value"));
        assertThat((Resp) channel.readInbound()).isEqualTo(command("PING"));
        channel.finish();
    }

    @Test
    @DisplayName("协议错误关闭连接")
    void protocolErrorClosesChannel() {
        final EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        write(channel, "*x\r\n");

        assertThat((Object) channel.readInbound()).isNull();
        assertThat(channel.isActive()).isFalse();
    }
}
