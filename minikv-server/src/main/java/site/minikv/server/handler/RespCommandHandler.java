package site.minikv.server.handler;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.minikv.aof.AofManager;
import site.minikv.command.CommandType;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.server.command.CommandDispatcher;

import java.io.IOException;

/**
 * 命令处理器，负责执行客户端请求并写回响应。
 *
 * <p>处理流程：
 * <ol>
 *     <li>写命令先追加到AOF，追加失败只记录日志，命令照常执行</li>
 *     <li>通过分发器执行命令</li>
 *     <li>写回响应</li>
 * </ol>
 *
 * <p>处理器无状态，可以在所有连接间共享。
 *
 * @since 1.0.0
 */
@Slf4j
@ChannelHandler.Sharable
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private final CommandDispatcher dispatcher;

    /** AOF管理器，未启用AOF时为null */
    private final AofManager aofManager;

    public RespCommandHandler(final CommandDispatcher dispatcher, final AofManager aofManager) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("CommandDispatcher不能为null");
        }
        this.dispatcher = dispatcher;
        this.aofManager = aofManager;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final Resp response = executeCommand(msg);
        if (!ctx.channel().isActive()) {
            log.debug("Channel 已关闭，跳过响应发送");
            return;
        }
        ctx.writeAndFlush(response);
    }

    /**
     * 执行一个请求，写命令在执行前追加到AOF。
     *
     * @param request 客户端请求
     * @return 命令执行结果
     */
    public Resp executeCommand(final Resp request) {
        final CommandType commandType = dispatcher.resolveType(request);
        if (commandType != null && commandType.isWriteCommand()) {
            appendToAof((RespArray) request, commandType);
        }
        return dispatcher.dispatch(request);
    }

    private void appendToAof(final RespArray request, final CommandType commandType) {
        if (aofManager == null) {
            return;
        }
        try {
            aofManager.append(request);
            log.debug("[AOF] 写命令已持久化: {}", commandType);
        } catch (IOException e) {
            log.error("[AOF] 持久化失败，命令: {}, 错误: {}", commandType, e.getMessage(), e);
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("连接异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
