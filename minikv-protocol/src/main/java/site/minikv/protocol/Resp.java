package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP协议基础类
 *
 * <p>所有RESP值类型的基类，同时承载协议的递归解析器和序列化入口。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头</li>
 *     <li>批量字符串 - 以"$"开头，长度为负表示Null</li>
 *     <li>数组 - 以"*"开头，元素可以是任意类型（包括嵌套数组）</li>
 * </ul>
 *
 * <p>解析结果有三种：
 * <ul>
 *     <li>完整的值 - 读指针恰好停在下一条记录的起点</li>
 *     <li>{@code null} - 缓冲区为空（干净结束）或记录不完整（读指针已回滚）</li>
 *     <li>{@link RespProtocolException} - 格式错误，读指针已回滚</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 类型标识 */
    public static final byte SIMPLE_STRING = '+';
    public static final byte ERROR = '-';
    public static final byte INTEGER = ':';
    public static final byte BULK_STRING = '$';
    public static final byte ARRAY = '*';

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[256][];

    private static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024; // 最大 512MB
    private static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;
    private static final int PROTO_MAX_NESTING_DEPTH = 1024;

    static {
        for (int i = 0; i < NUMBERS.length; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 记录不完整的内部信号，在{@link #decode(ByteBuf)}中被转换为null。
     */
    private static final class IncompleteRecord extends RuntimeException {
        private static final IncompleteRecord INSTANCE = new IncompleteRecord();

        private IncompleteRecord() {
            super("incomplete RESP record", null, false, false);
        }
    }

    /**
     * 将当前值编码到缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 将值序列化为字节数组，null被当作空输入处理并返回空数组
     *
     * @param resp 待序列化的值
     * @return RESP线路格式的字节
     */
    public static byte[] serialize(final Resp resp) {
        if (resp == null) {
            return new byte[0];
        }
        final ByteBuf buf = Unpooled.buffer();
        try {
            resp.encode(buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * 写入十进制整数，小的非负数走缓存
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeDecimal(final ByteBuf buf, final long value) {
        if (value >= 0 && value < NUMBERS.length) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * RESP 协议解码方法，从读指针处解析恰好一个顶层值。
     *
     * @param buffer 输入缓冲区
     * @return 解码后的 Resp 对象；缓冲区为空或数据不完整时返回null
     * @throws RespProtocolException 当数据格式不符合RESP协议规范时
     */
    public static Resp decode(final ByteBuf buffer) {
        // 1. 没有可读数据，干净结束
        if (!buffer.isReadable()) {
            return null;
        }

        // 2. 保存初始读索引，以便不完整或出错时回滚
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeValue(buffer, 0);
        } catch (IncompleteRecord e) {
            buffer.readerIndex(initialIndex);
            return null;
        } catch (RespProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp decodeValue(final ByteBuf buffer, final int depth) {
        if (!buffer.isReadable()) {
            throw IncompleteRecord.INSTANCE;
        }
        final byte typeIndicator = buffer.readByte();
        switch (typeIndicator) {
            case SIMPLE_STRING:
                return SimpleString.valueOf(readLine(buffer));
            case ERROR:
                return new Errors(readLine(buffer));
            case INTEGER:
                return RespInteger.valueOf(readNumber(buffer));
            case BULK_STRING:
                return decodeBulkString(buffer);
            case ARRAY:
                return decodeArray(buffer, depth);
            default:
                // 3. 无法识别的类型标记按Null处理，不中断连接
                log.warn("无法识别的RESP类型标识: '{}' (字节值: {})", (char) typeIndicator, typeIndicator & 0xFF);
                return BulkString.NULL;
        }
    }

    private static Resp decodeBulkString(final ByteBuf buffer) {
        final long length = readNumber(buffer);
        if (length < 0) {
            // 负长度表示Null，不读取载荷
            return BulkString.NULL;
        }
        if (length > PROTO_MAX_BULK_LEN) {
            throw new RespProtocolException("批量字符串长度超过最大限制 " + PROTO_MAX_BULK_LEN + ": " + length);
        }
        final int size = (int) length;
        if (buffer.readableBytes() < size + 2) {
            throw IncompleteRecord.INSTANCE;
        }

        // 载荷原样读取，内部的CRLF不被当作分隔符
        final byte[] content = new byte[size];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new RespProtocolException("批量字符串格式错误：载荷后期望\\r\\n");
        }
        return BulkString.wrapTrusted(content);
    }

    private static Resp decodeArray(final ByteBuf buffer, final int depth) {
        final long count = readNumber(buffer);
        if (count < 0) {
            return BulkString.NULL;
        }
        if (count > PROTO_MAX_ARRAY_LEN) {
            throw new RespProtocolException("数组元素数量超过最大限制 " + PROTO_MAX_ARRAY_LEN + ": " + count);
        }
        if (count == 0) {
            return RespArray.EMPTY;
        }
        if (depth >= PROTO_MAX_NESTING_DEPTH) {
            throw new RespProtocolException("数组嵌套深度超过最大限制 " + PROTO_MAX_NESTING_DEPTH);
        }

        // 声明的数量不可信，预分配不超过已到达的字节数；任一元素失败都放弃整个数组
        final List<Resp> elements = new ArrayList<>((int) Math.min(count, buffer.readableBytes()));
        for (long i = 0; i < count; i++) {
            elements.add(decodeValue(buffer, depth + 1));
        }
        return new RespArray(elements.toArray(new Resp[0]));
    }

    /**
     * 读取到CRLF为止的一行，返回去掉结束符的UTF-8文本
     */
    private static String readLine(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findLineEnd(buffer);
        final String line = buffer.toString(startIndex, endIndex - startIndex, StandardCharsets.UTF_8);
        buffer.readerIndex(endIndex + 2);
        return line;
    }

    /**
     * 读取长度行或整数行，按十进制有符号整数解析
     */
    private static long readNumber(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findLineEnd(buffer);
        final int length = endIndex - startIndex;
        if (length == 0) {
            throw new RespProtocolException("数字解析错误：长度行为空");
        }

        boolean negative = false;
        int index = startIndex;
        if (buffer.getByte(index) == '-') {
            if (length == 1) {
                throw new RespProtocolException("数字解析错误：只有负号");
            }
            negative = true;
            index++;
        }

        // 以负数累加，Long.MIN_VALUE也能被表示
        final long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        final long multmin = limit / 10;
        long result = 0;
        for (; index < endIndex; index++) {
            final byte b = buffer.getByte(index);
            if (b < '0' || b > '9') {
                throw new RespProtocolException("数字解析错误：包含非数字字符 '" + (char) b + "'");
            }
            final int digit = b - '0';
            if (result < multmin) {
                throw new RespProtocolException("数字解析错误：数值溢出");
            }
            result *= 10;
            if (result < limit + digit) {
                throw new RespProtocolException("数字解析错误：数值溢出");
            }
            result -= digit;
        }

        buffer.readerIndex(endIndex + 2);
        return negative ? result : -result;
    }

    /**
     * 查找当前行的'\r'位置，并确认其后紧跟'\n'
     */
    private static int findLineEnd(final ByteBuf buffer) {
        final int endIndex = buffer.indexOf(buffer.readerIndex(), buffer.writerIndex(), (byte) '\r');
        if (endIndex < 0 || endIndex + 1 >= buffer.writerIndex()) {
            throw IncompleteRecord.INSTANCE;
        }
        if (buffer.getByte(endIndex + 1) != '\n') {
            throw new RespProtocolException("格式错误：'\\r'之后期望'\\n'");
        }
        return endIndex;
    }
}
