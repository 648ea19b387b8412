package site.minikv.server.config;

import lombok.Builder;
import lombok.Data;
import site.minikv.aof.writer.AofSyncPolicy;

/**
 * 服务器配置
 *
 * @since 1.0.0
 */
@Data
@Builder
public class KvServerConfig {

    // ========== 网络配置 ==========

    @Builder.Default
    private String host = "0.0.0.0";

    /** 0表示由系统分配端口 */
    @Builder.Default
    private int port = 6379;

    @Builder.Default
    private int backlogSize = 1024;

    // ========== 持久化配置 ==========

    @Builder.Default
    private boolean aofEnabled = true;

    @Builder.Default
    private String aofFileName = "database.aof";

    @Builder.Default
    private AofSyncPolicy aofSyncPolicy = AofSyncPolicy.EVERYSEC;

    @Builder.Default
    private long flushIntervalMs = 1000;

    // ========== 线程配置 ==========

    @Builder.Default
    private int bossThreadCount = 1;

    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();
}
