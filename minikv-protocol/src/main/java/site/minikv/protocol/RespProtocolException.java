package site.minikv.protocol;

/**
 * RESP协议格式错误。
 *
 * <p>长度行非数字、批量字符串后缺少CRLF、长度或嵌套深度超过协议上限时抛出。
 * 抛出后输入流的位置不再可用于重新同步，调用方应当关闭连接或放弃整个日志。
 *
 * @since 1.0.0
 */
public class RespProtocolException extends RuntimeException {

    public RespProtocolException(final String message) {
        super(message);
    }
}
