package site.minikv.aof.writer;

/**
 * AOF刷盘策略
 *
 * @since 1.0.0
 */
public enum AofSyncPolicy {
    /**
     * 不主动刷盘，完全依赖操作系统的缓冲区刷新机制。
     * 系统崩溃时可能丢失最近一段时间的数据。
     */
    NO,

    /**
     * 每次追加后立即刷盘，安全性最高，写入延迟也最高。
     */
    ALWAYS,

    /**
     * 后台线程按固定间隔刷盘（默认1秒），无论期间是否有写入。
     */
    EVERYSEC
}
