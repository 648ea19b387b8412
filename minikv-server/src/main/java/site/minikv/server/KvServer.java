package site.minikv.server;

import site.minikv.aof.AofManager;
import site.minikv.core.KvCore;

/**
 * 键值服务器接口
 *
 * @since 1.0.0
 */
public interface KvServer {

    /**
     * 重放AOF后开始监听端口，返回时服务器已可以接受连接。
     *
     * @throws IllegalStateException AOF无法打开或重放失败时抛出
     */
    void start();

    /**
     * 停止监听并释放线程和文件资源。
     */
    void stop();

    KvCore getKvCore();

    /**
     * @return AOF管理器，未启用AOF或未启动时为null
     */
    AofManager getAofManager();
}
