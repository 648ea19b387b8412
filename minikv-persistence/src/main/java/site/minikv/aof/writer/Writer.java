package site.minikv.aof.writer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * 持久化写入器接口
 *
 * @since 1.0.0
 */
public interface Writer {
    /**
     * 把缓冲区内容完整追加到文件末尾
     *
     * @param buffer 待写入的数据缓冲区
     * @return 实际写入的字节数
     * @throws IOException 写入过程中发生IO错误
     */
    int write(ByteBuffer buffer) throws IOException;

    /**
     * 将已写入的数据刷新到磁盘
     *
     * @throws IOException 刷盘过程中发生IO错误
     */
    void flush() throws IOException;

    /**
     * @return 底层文件通道，供重放时按位置读取
     */
    FileChannel getChannel();

    /**
     * 关闭写入器并释放相关资源
     *
     * @throws IOException 关闭过程中发生IO错误
     */
    void close() throws IOException;
}
