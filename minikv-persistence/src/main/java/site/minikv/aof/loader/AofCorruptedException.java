package site.minikv.aof.loader;

import lombok.Getter;

import java.io.IOException;

/**
 * AOF文件中存在截断或格式错误的记录
 *
 * @since 1.0.0
 */
@Getter
public class AofCorruptedException extends IOException {
    /** 出错记录在文件中的起始字节偏移 */
    private final long offset;

    public AofCorruptedException(final long offset, final String message) {
        super(message + " (offset " + offset + ")");
        this.offset = offset;
    }

    public AofCorruptedException(final long offset, final String message, final Throwable cause) {
        super(message + " (offset " + offset + ")", cause);
        this.offset = offset;
    }
}
