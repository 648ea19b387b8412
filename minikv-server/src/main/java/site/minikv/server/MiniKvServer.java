package site.minikv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.aof.AofManager;
import site.minikv.core.KvCore;
import site.minikv.core.KvCoreImpl;
import site.minikv.protocol.handler.RespDecoder;
import site.minikv.protocol.handler.RespEncoder;
import site.minikv.server.command.CommandDispatcher;
import site.minikv.server.config.KvServerConfig;
import site.minikv.server.handler.RespCommandHandler;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * 基于Netty的键值服务器。
 *
 * <p>启动顺序：
 * <ol>
 *     <li>打开AOF文件</li>
 *     <li>通过分发器重放AOF，丢弃所有回复</li>
 *     <li>绑定端口，开始接受连接</li>
 * </ol>
 *
 * <p>每个连接的命令处理器绑定到命令执行线程池中的一个线程，
 * 同一连接的请求按到达顺序执行，不同连接之间并发执行。
 *
 * @since 1.0.0
 */
@Slf4j
@Getter
public class MiniKvServer implements KvServer {

    private final KvServerConfig config;

    private final KvCore kvCore;

    private final CommandDispatcher dispatcher;

    /** 服务器Channel类型，根据操作系统自动选择最优实现 */
    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    private Channel serverChannel;

    private AofManager aofManager;

    public MiniKvServer(final KvServerConfig config) {
        this(config, new KvCoreImpl());
    }

    public MiniKvServer(final KvServerConfig config, final KvCore kvCore) {
        this.config = config;
        this.kvCore = kvCore;
        this.dispatcher = new CommandDispatcher(kvCore);
    }

    @Override
    public void start() {
        // 1. 打开并重放AOF，失败则放弃启动
        if (config.isAofEnabled()) {
            openAndReplayAof();
        }

        // 2. 初始化线程组
        initializeEventLoopGroups();
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(), new DefaultThreadFactory("minikv-cmd"));

        // 3. 绑定端口
        final RespCommandHandler commandHandler = new RespCommandHandler(dispatcher, aofManager);
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, commandHandler);
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("MiniKv server started at {}:{}", config.getHost(), getBoundPort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("启动服务器时被中断", e);
        } catch (RuntimeException e) {
            stop();
            throw new IllegalStateException("绑定端口失败: " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    private void openAndReplayAof() {
        try {
            this.aofManager = new AofManager(config.getAofFileName(),
                    config.getAofSyncPolicy(), config.getFlushIntervalMs());
            final int replayed = aofManager.replay(dispatcher::dispatch);
            log.info("AOF重放完成，共 {} 条命令", replayed);
        } catch (IOException | RuntimeException e) {
            closeAof();
            throw new IllegalStateException("AOF加载失败: " + config.getAofFileName(), e);
        }
    }

    /**
     * @return 实际监听的端口，未启动时返回-1
     */
    public int getBoundPort() {
        if (serverChannel == null || !(serverChannel.localAddress() instanceof InetSocketAddress)) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
                serverChannel = null;
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully().sync();
            }
        } catch (InterruptedException e) {
            log.error("MiniKv server stop error", e);
            Thread.currentThread().interrupt();
        } finally {
            closeAof();
        }
        log.info("MiniKv server stopped");
    }

    private void closeAof() {
        if (aofManager == null) {
            return;
        }
        try {
            aofManager.close();
        } catch (IOException e) {
            log.error("关闭AOF文件失败: {}", config.getAofFileName(), e);
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }
}
