package site.minikv.server.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import site.minikv.aof.AofManager;
import site.minikv.aof.writer.AofSyncPolicy;
import site.minikv.core.KvCoreImpl;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.SimpleString;
import site.minikv.protocol.handler.RespDecoder;
import site.minikv.protocol.handler.RespEncoder;
import site.minikv.server.command.CommandDispatcher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("命令处理器测试")
class RespCommandHandlerTest {

    @TempDir
    Path tempDir;

    private Path aofFile;
    private AofManager aofManager;
    private RespCommandHandler handler;

    private static RespArray command(final String... parts) {
        final Resp[] content = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            content[i] = BulkString.fromString(parts[i]);
        }
        return new RespArray(content);
    }

    @BeforeEach
    void setUp() throws IOException {
        aofFile = tempDir.resolve("handler.aof");
        aofManager = new AofManager(aofFile.toString(), AofSyncPolicy.ALWAYS, 1000);
        handler = new RespCommandHandler(new CommandDispatcher(new KvCoreImpl()), aofManager);
    }

    @AfterEach
    void tearDown() throws IOException {
        aofManager.close();
    }

    @Test
    @DisplayName("写命令被追加到AOF，读命令不追加")
    void onlyWritesAreLogged() throws IOException {
        handler.executeCommand(command("SET", "k", "1"));
        final long sizeAfterSet = Files.size(aofFile);
        assertThat(sizeAfterSet).isGreaterThan(0);

        handler.executeCommand(command("GET", "k"));
        handler.executeCommand(command("HGET", "h", "f"));
        handler.executeCommand(command("PING"));
        assertThat(Files.size(aofFile)).isEqualTo(sizeAfterSet);

        handler.executeCommand(command("hset", "h", "f", "2"));
        assertThat(Files.size(aofFile)).isGreaterThan(sizeAfterSet);
    }

    @Test
    @DisplayName("参数错误的写命令也按原样记录")
    void invalidWriteStillLogged() throws IOException {
        assertThat(handler.executeCommand(command("SET", "k"))).isInstanceOf(Errors.class);
        assertThat(Files.size(aofFile)).isGreaterThan(0);
    }

    @Test
    @DisplayName("重放AOF重建状态")
    void replayReconstructsState() throws IOException {
        handler.executeCommand(command("SET", "k", "1"));
        handler.executeCommand(command("HSET", "h", "f", "2"));

        final CommandDispatcher fresh = new CommandDispatcher(new KvCoreImpl());
        assertThat(aofManager.replay(fresh::dispatch)).isEqualTo(2);

        assertThat(fresh.dispatch(command("GET", "k"))).isEqualTo(BulkString.fromString("1"));
        assertThat(fresh.dispatch(command("HGET", "h", "f"))).isEqualTo(BulkString.fromString("2"));
    }

    @Test
    @DisplayName("AOF追加失败不影响命令执行")
    void appendFailureIsBestEffort() throws IOException {
        final AofManager failing = mock(AofManager.class);
        doThrow(new IOException("disk full")).when(failing).append(any(RespArray.class));
        final RespCommandHandler failingHandler =
                new RespCommandHandler(new CommandDispatcher(new KvCoreImpl()), failing);

        assertThat(failingHandler.executeCommand(command("SET", "k", "v"))).isEqualTo(SimpleString.OK);
        assertThat(failingHandler.executeCommand(command("GET", "k"))).isEqualTo(BulkString.fromString("v"));
    }

    @Test
    @DisplayName("未启用AOF时正常执行")
    void withoutAof() {
        final RespCommandHandler noAof = new RespCommandHandler(new CommandDispatcher(new KvCoreImpl()), null);

        assertThat(noAof.executeCommand(command("SET", "k", "v"))).isEqualTo(SimpleString.OK);
        assertThat(noAof.executeCommand(command("GET", "k"))).isEqualTo(BulkString.fromString("v"));
    }

    @Test
    @DisplayName("完整管道：字节进，字节出")
    void pipeline() {
        final EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(), handler);
        channel.writeInbound(Unpooled.copiedBuffer(
                "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n*1\r\n$3\r\nFOO\r\n",
                StandardCharsets.UTF_8));

        assertThat(readOutbound(channel)).isEqualTo("+OK\r\n");
        assertThat(readOutbound(channel)).isEqualTo("$1\r\nv\r\n");
        assertThat(readOutbound(channel)).isEqualTo("-ERR unknown command 'FOO'\r\n");
        assertThat(channel.isActive()).isTrue();
        channel.finish();
    }

    @Test
    @DisplayName("非数组请求返回错误且不断开连接")
    void invalidRequestKeepsConnection() {
        final EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(), handler);
        channel.writeInbound(Unpooled.copiedBuffer("+PING\r\n", StandardCharsets.UTF_8));

        assertThat(readOutbound(channel))
                .isEqualTo("-ERR invalid request, expected non-empty array of bulk strings\r\n");
        assertThat(channel.isActive()).isTrue();
        channel.finish();
    }

    private static String readOutbound(final EmbeddedChannel channel) {
        final ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }
}
