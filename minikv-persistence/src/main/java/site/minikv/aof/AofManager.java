package site.minikv.aof;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.aof.loader.AofLoader;
import site.minikv.aof.writer.AofSyncPolicy;
import site.minikv.aof.writer.AofWriter;
import site.minikv.aof.writer.Writer;
import site.minikv.protocol.RespArray;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * AOF 持久化管理器
 *
 * <p>拥有AOF文件的唯一句柄，负责命令追加、按策略刷盘、启动时重放和关闭。
 * 追加、刷盘、重放和关闭互斥执行，任意两条记录的字节不会交错。
 *
 * <p>生命周期：
 * <ol>
 *     <li>构造 - 打开（必要时创建）文件，EVERYSEC策略下启动定时刷盘</li>
 *     <li>{@link #replay(Consumer)} - 从文件开头重放已有命令</li>
 *     <li>{@link #append(RespArray)} - 运行期间追加写命令</li>
 *     <li>{@link #close()} - 停止定时刷盘，最后刷盘一次并关闭文件</li>
 * </ol>
 *
 * @since 1.0.0
 */
@Slf4j
public class AofManager implements AutoCloseable {
    /** 默认刷盘间隔 */
    public static final long DEFAULT_FLUSH_INTERVAL_MS = 1000;

    @Getter
    private final String fileName;

    @Getter
    private final AofSyncPolicy syncPolicy;

    private final Writer aofWriter;

    private final AofLoader aofLoader;

    /** 写入锁，保证并发安全 */
    private final ReentrantLock writeLock = new ReentrantLock();

    /** ByteBuf 分配器，使用 Netty 的池化分配器 */
    private final ByteBufAllocator allocator = PooledByteBufAllocator.DEFAULT;

    /** EVERYSEC策略下的定时刷盘调度器，其他策略为null */
    private final ScheduledExecutorService flushScheduler;

    private volatile boolean closed;

    public AofManager(final String fileName) throws IOException {
        this(fileName, AofSyncPolicy.EVERYSEC, DEFAULT_FLUSH_INTERVAL_MS);
    }

    /**
     * @param fileName AOF文件名
     * @param syncPolicy 刷盘策略
     * @param flushIntervalMs EVERYSEC策略下的刷盘间隔，必须为正数
     * @throws IOException 文件无法打开或创建时抛出
     */
    public AofManager(final String fileName, final AofSyncPolicy syncPolicy,
                      final long flushIntervalMs) throws IOException {
        this(fileName, openWriter(fileName, syncPolicy, flushIntervalMs), syncPolicy, flushIntervalMs);
    }

    /**
     * 使用已打开的写入器构造，写入器的所有权转移给本管理器
     */
    AofManager(final String fileName, final Writer aofWriter, final AofSyncPolicy syncPolicy,
               final long flushIntervalMs) {
        checkFlushInterval(syncPolicy, flushIntervalMs);
        this.fileName = fileName;
        this.syncPolicy = syncPolicy;
        this.aofWriter = aofWriter;
        this.aofLoader = new AofLoader(fileName);

        // EVERYSEC模式下启动定时刷盘
        if (syncPolicy == AofSyncPolicy.EVERYSEC) {
            this.flushScheduler = new ScheduledThreadPoolExecutor(1, r -> {
                final Thread thread = new Thread(r);
                thread.setName("AOF-Flush-Scheduler");
                thread.setDaemon(true);
                return thread;
            });
            this.flushScheduler.scheduleAtFixedRate(this::scheduledFlushTask,
                    flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
            log.info("EVERYSEC刷盘模式已启动，刷盘间隔: {}ms", flushIntervalMs);
        } else {
            this.flushScheduler = null;
        }
        log.info("AofManager初始化完成，文件: {}, 刷盘策略: {}", fileName, syncPolicy);
    }

    private static Writer openWriter(final String fileName, final AofSyncPolicy syncPolicy,
                                     final long flushIntervalMs) throws IOException {
        // 参数非法时不打开文件
        checkFlushInterval(syncPolicy, flushIntervalMs);
        return new AofWriter(Paths.get(fileName));
    }

    private static void checkFlushInterval(final AofSyncPolicy syncPolicy, final long flushIntervalMs) {
        if (syncPolicy == AofSyncPolicy.EVERYSEC && flushIntervalMs <= 0) {
            throw new IllegalArgumentException("刷盘间隔必须为正数: " + flushIntervalMs);
        }
    }

    /**
     * 定时刷盘任务，失败时记录日志并等待下一个周期
     */
    private void scheduledFlushTask() {
        if (closed) {
            return;
        }
        try {
            flush();
            log.trace("EVERYSEC定时刷盘完成");
        } catch (IOException e) {
            log.error("EVERYSEC定时刷盘失败", e);
        }
    }

    /**
     * 向AOF文件追加一条命令记录
     *
     * @param respArray 命令数组
     * @throws IOException 写入失败或管理器已关闭时抛出
     * @throws IllegalArgumentException 参数为null时抛出
     */
    public void append(final RespArray respArray) throws IOException {
        if (respArray == null) {
            throw new IllegalArgumentException("RespArray cannot be null");
        }

        // 1. 锁外编码，缩短持锁时间
        final ByteBuf byteBuf = allocator.buffer();
        try {
            respArray.encode(byteBuf);

            // 2. 整条记录一次写入
            writeLock.lock();
            try {
                ensureOpen();
                aofWriter.write(byteBuf.nioBuffer());
                if (syncPolicy == AofSyncPolicy.ALWAYS) {
                    aofWriter.flush();
                }
            } finally {
                writeLock.unlock();
            }
        } finally {
            byteBuf.release();
        }
    }

    /**
     * 强制把已追加的数据刷新到磁盘
     *
     * @throws IOException 刷新失败时抛出
     */
    public void flush() throws IOException {
        writeLock.lock();
        try {
            ensureOpen();
            aofWriter.flush();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 从文件开头重放所有命令
     *
     * @param consumer 每条命令的处理回调，在持锁状态下调用，不能再调用本管理器
     * @return 重放的命令数
     * @throws IOException 文件读取失败，或记录截断/格式错误（{@link site.minikv.aof.loader.AofCorruptedException}）
     */
    public int replay(final Consumer<RespArray> consumer) throws IOException {
        writeLock.lock();
        try {
            ensureOpen();
            return aofLoader.load(aofWriter.getChannel(), consumer);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 关闭管理器：停止定时刷盘，最后刷盘一次并关闭文件。重复调用无效果。
     *
     * @throws IOException 最后的刷盘或关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            writeLock.unlock();
        }

        // 1. 先停止定时刷盘，锁外等待避免与刷盘任务互相等待
        if (flushScheduler != null) {
            flushScheduler.shutdown();
            try {
                if (!flushScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    flushScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                flushScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // 2. 再刷盘并关闭文件
        writeLock.lock();
        try {
            aofWriter.close();
            log.info("AOF管理器关闭完成: {}", fileName);
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("AOF管理器已关闭: " + fileName);
        }
    }
}
