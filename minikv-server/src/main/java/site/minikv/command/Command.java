package site.minikv.command;

import site.minikv.protocol.Resp;

/**
 * 命令接口，定义了所有命令的基本行为。
 *
 * <p>每个请求创建一个新的命令实例：先用 {@link #setContext(Resp[])} 注入参数，
 * 再调用 {@link #handle()} 执行。参数个数由各命令在 {@code handle()} 中自行校验，
 * 不符合时返回错误值而不是抛出异常。
 *
 * @since 1.0.0
 */
public interface Command {

    /**
     * @return 命令类型
     */
    CommandType getType();

    /**
     * 设置命令参数。
     *
     * @param args 命令名之后的参数，可以为空数组
     */
    void setContext(Resp[] args);

    /**
     * 执行命令并返回结果。
     *
     * @return RESP协议格式的执行结果
     */
    Resp handle();

    /**
     * 是否为需要写入AOF的写命令，由命令表统一决定。
     */
    default boolean isWriteCommand() {
        return getType().isWriteCommand();
    }
}
