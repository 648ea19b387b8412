package site.minikv;

import lombok.extern.slf4j.Slf4j;
import site.minikv.server.KvServer;
import site.minikv.server.MiniKvServer;
import site.minikv.server.config.KvServerConfig;

/**
 * 服务器启动入口，端口和AOF文件可以通过 {@code -Dminikv.port}、{@code -Dminikv.aof.file} 覆盖
 */
@Slf4j
public class MiniKvServerLauncher {
    public static void main(String[] args) {
        final KvServerConfig config = KvServerConfig.builder()
                .port(Integer.getInteger("minikv.port", 6379))
                .aofFileName(System.getProperty("minikv.aof.file", "database.aof"))
                .build();

        final KvServer server = new MiniKvServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            server.stop();
            log.info("服务器已安全关闭");
        }, "minikv-shutdown"));

        server.start();
    }
}
