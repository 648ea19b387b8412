package site.minikv.command;

import lombok.Getter;
import site.minikv.command.impl.Ping;
import site.minikv.command.impl.hash.Hget;
import site.minikv.command.impl.hash.Hgetall;
import site.minikv.command.impl.hash.Hset;
import site.minikv.command.impl.string.Get;
import site.minikv.command.impl.string.Set;
import site.minikv.core.KvCore;
import site.minikv.datastructure.KvBytes;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令表，定义了系统支持的所有命令。
 *
 * <p>每个条目带有命令名、是否为写命令以及创建命令实例的工厂方法。
 * 写命令标志是决定是否追加AOF的唯一依据。
 *
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    /** PING命令：测试服务器连接 */
    PING("PING", false),
    /** SET命令：设置键值对 */
    SET("SET", true),
    /** GET命令：获取键值 */
    GET("GET", false),
    /** HSET命令：设置哈希字段 */
    HSET("HSET", true),
    /** HGET命令：获取哈希字段 */
    HGET("HGET", false),
    /** HGETALL命令：获取哈希的全部字段和值 */
    HGETALL("HGETALL", false);

    /** 命令查找缓存 */
    private static final Map<KvBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    private final KvBytes commandBytes;

    /** 错误消息中使用的小写命令名 */
    private final String lowerName;

    private final boolean writeCommand;

    CommandType(final String commandName, final boolean writeCommand) {
        this.commandBytes = KvBytes.fromString(commandName);
        this.lowerName = commandName.toLowerCase(Locale.ROOT);
        this.writeCommand = writeCommand;
    }

    /**
     * 大小写不敏感地查找命令类型。
     *
     * @param commandBytes 命令名字节
     * @return 对应的CommandType，不存在时返回null
     */
    public static CommandType findByBytes(final KvBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        for (final CommandType type : values()) {
            if (type.commandBytes.equalsIgnoreCase(commandBytes)) {
                return type;
            }
        }
        return null;
    }

    /**
     * 大小写不敏感地按名称查找命令类型。
     *
     * @param commandName 命令名称字符串
     * @return 对应的CommandType，不存在时返回null
     */
    public static CommandType findByName(final String commandName) {
        if (commandName == null || commandName.isEmpty()) {
            return null;
        }
        return COMMAND_CACHE.get(KvBytes.fromString(commandName.toUpperCase(Locale.ROOT)));
    }

    /**
     * 创建绑定到指定存储的命令实例。
     *
     * @param kvCore 键值存储
     * @return 新的命令实例
     */
    public Command createCommand(final KvCore kvCore) {
        switch (this) {
            case PING:
                return new Ping();
            case SET:
                return new Set(kvCore);
            case GET:
                return new Get(kvCore);
            case HSET:
                return new Hset(kvCore);
            case HGET:
                return new Hget(kvCore);
            case HGETALL:
                return new Hgetall(kvCore);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
