package site.minikv.server.command;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.core.KvCore;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;

import java.util.Arrays;
import java.util.Locale;

/**
 * 命令分发器，把请求解析为命令并在存储上执行。
 *
 * <p>分发器本身不写AOF，写命令的持久化由调用方在分发之前完成。
 * 重放AOF时也通过分发器执行，结果直接丢弃。
 *
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {
    /** 请求不是以批量字符串开头的非空数组 */
    static final Errors INVALID_REQUEST_ERROR =
            new Errors("ERR invalid request, expected non-empty array of bulk strings");

    /** 命令执行过程中出现意外异常 */
    static final Errors INTERNAL_ERROR = new Errors("ERR internal error");

    @Getter
    private final KvCore kvCore;

    public CommandDispatcher(final KvCore kvCore) {
        if (kvCore == null) {
            throw new IllegalArgumentException("KvCore不能为null");
        }
        this.kvCore = kvCore;
    }

    /**
     * 解析请求中的命令类型，用于在分发前判断是否为写命令。
     *
     * @param request 客户端请求
     * @return 命令类型，请求不合法或命令不存在时返回null
     */
    public CommandType resolveType(final Resp request) {
        final BulkString name = commandName(request);
        return name == null ? null : CommandType.findByBytes(name.getContent());
    }

    /**
     * 执行一个完整的请求。
     *
     * @param request 客户端请求，应为以命令名开头的数组
     * @return 执行结果，从不返回null
     */
    public Resp dispatch(final Resp request) {
        final BulkString name = commandName(request);
        if (name == null) {
            return INVALID_REQUEST_ERROR;
        }
        final Resp[] content = ((RespArray) request).getContent();
        return dispatch(name.getString(), Arrays.copyOfRange(content, 1, content.length));
    }

    /**
     * 按名称执行命令。
     *
     * @param commandName 命令名，大小写不敏感
     * @param args 命令参数
     * @return 执行结果，从不返回null
     */
    public Resp dispatch(final String commandName, final Resp[] args) {
        // 1. 查找命令
        final CommandType commandType = CommandType.findByName(commandName);
        if (commandType == null) {
            final String upper = commandName == null ? "" : commandName.toUpperCase(Locale.ROOT);
            return new Errors("ERR unknown command '" + upper + "'");
        }

        // 2. 创建实例并执行，参数个数由命令自己校验
        try {
            final Command command = commandType.createCommand(kvCore);
            command.setContext(args == null ? new Resp[0] : args);
            final Resp result = command.handle();
            log.debug("执行命令: {}, 结果: {}", commandType, result);
            return result;
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", commandType, e);
            return INTERNAL_ERROR;
        }
    }

    private static BulkString commandName(final Resp request) {
        if (!(request instanceof RespArray)) {
            return null;
        }
        final Resp[] content = ((RespArray) request).getContent();
        if (content.length == 0 || !(content[0] instanceof BulkString) || ((BulkString) content[0]).isNull()) {
            return null;
        }
        return (BulkString) content[0];
    }
}
