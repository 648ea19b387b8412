package site.minikv.aof.writer;

import lombok.extern.slf4j.Slf4j;
import site.minikv.aof.utils.FileUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * AOF文件写入器
 *
 * <p>以追加模式持有AOF文件的通道，写入总是落在文件末尾。
 * 同一个通道也用于重放时的按位置读取，不改变写入位置。
 *
 * <p>本类不是线程安全的，由 {@code AofManager} 的写锁保护。
 *
 * @since 1.0.0
 */
@Slf4j
public class AofWriter implements Writer {
    private final Path path;
    private FileChannel channel;

    /**
     * 打开AOF文件，不存在时创建
     *
     * @param path AOF文件路径
     * @throws IOException 文件无法打开或创建时抛出
     */
    public AofWriter(final Path path) throws IOException {
        this.path = path;
        try {
            this.channel = FileUtils.openAppendChannel(path);
        } catch (IOException e) {
            throw new IOException("初始化AOF Writer时发生错误: " + path, e);
        }
        log.info("AOF文件已打开: {}, 当前大小: {} bytes", path, channel.size());
    }

    @Override
    public int write(final ByteBuffer buffer) throws IOException {
        if (channel == null || !channel.isOpen()) {
            throw new IOException("AOF Writer 已关闭，无法执行写入操作");
        }
        int written = 0;
        while (buffer.hasRemaining()) {
            written += channel.write(buffer);
        }
        return written;
    }

    @Override
    public void flush() throws IOException {
        if (channel == null || !channel.isOpen()) {
            throw new IOException("AOF Writer 已关闭，无法刷盘");
        }
        channel.force(true);
    }

    @Override
    public FileChannel getChannel() {
        return channel;
    }

    @Override
    public void close() throws IOException {
        if (channel == null) {
            return;
        }
        try {
            if (channel.isOpen()) {
                channel.force(true);
            }
        } finally {
            channel.close();
            channel = null;
            log.info("AOF文件已关闭: {}", path);
        }
    }
}
