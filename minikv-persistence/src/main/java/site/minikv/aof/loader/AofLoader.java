package site.minikv.aof.loader;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespProtocolException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.function.Consumer;

/**
 * AOF文件加载器
 *
 * <p>从文件开头读取全部内容，逐条解析RESP记录并交给回调执行。
 * 文件在最后一条完整记录之后结束视为正常；记录被截断或格式错误时整个重放失败，
 * 不尝试跳过坏数据继续恢复。
 *
 * <p>使用示例：
 * <pre>{@code
 * int applied = new AofLoader("database.aof").load(channel, command -> dispatcher.dispatch(command));
 * }</pre>
 *
 * @since 1.0.0
 */
@Slf4j
public class AofLoader {
    private static final int READ_CHUNK_SIZE = 64 * 1024;

    private final String fileName;

    public AofLoader(final String fileName) {
        this.fileName = fileName;
    }

    /**
     * 重放文件中的全部命令
     *
     * @param channel 文件通道，按位置读取，不改变通道位置
     * @param consumer 每条命令记录的处理回调
     * @return 成功交给回调的记录数
     * @throws AofCorruptedException 记录被截断或格式错误时抛出
     * @throws IOException 读取文件失败时抛出
     */
    public int load(final FileChannel channel, final Consumer<RespArray> consumer) throws IOException {
        final long size = channel.size();
        if (size == 0) {
            log.info("AOF文件为空，跳过加载: {}", fileName);
            return 0;
        }
        if (size > Integer.MAX_VALUE) {
            throw new IOException("AOF文件过大，无法一次加载: " + fileName + " (" + size + " bytes)");
        }

        log.info("开始加载AOF文件: {}, 文件大小: {} bytes", fileName, size);
        final ByteBuf commands = readFileContent(channel, (int) size);
        try {
            final int applied = processCommands(commands, consumer);
            log.info("AOF文件加载完成，成功执行 {} 条命令", applied);
            return applied;
        } finally {
            commands.release();
        }
    }

    private ByteBuf readFileContent(final FileChannel channel, final int size) throws IOException {
        final ByteBuf buffer = Unpooled.buffer(size);
        try {
            long position = 0;
            while (position < size) {
                final int read = buffer.writeBytes(channel, position, Math.min(READ_CHUNK_SIZE, size - (int) position));
                if (read < 0) {
                    break;
                }
                position += read;
            }
            return buffer;
        } catch (IOException e) {
            buffer.release();
            throw new IOException("读取AOF文件失败: " + fileName, e);
        }
    }

    private int processCommands(final ByteBuf commands, final Consumer<RespArray> consumer) throws AofCorruptedException {
        int applied = 0;
        while (commands.isReadable()) {
            final int position = commands.readerIndex();

            // 1. 解析一条记录，剩余字节不足一条完整记录即为截断
            final Resp command;
            try {
                command = Resp.decode(commands);
            } catch (RespProtocolException e) {
                throw new AofCorruptedException(position, "AOF记录格式错误: " + e.getMessage(), e);
            }
            if (command == null) {
                throw new AofCorruptedException(position, "AOF记录被截断");
            }

            // 2. 只有数组才是命令
            if (!(command instanceof RespArray)) {
                log.warn("跳过非数组的AOF记录，位置: {}, 类型: {}", position, command.getClass().getSimpleName());
                continue;
            }
            consumer.accept((RespArray) command);
            applied++;
        }
        return applied;
    }
}
