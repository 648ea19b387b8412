package site.minikv.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变字节串封装类，作为存储引擎的键、字段、值以及协议层批量字符串的载荷。
 *
 * <p>本类为字节数组提供不可变封装：
 * <ul>
 *   <li>哈希值预计算：作为HashMap键时避免重复计算
 *   <li>字符串延迟缓存：首次调用{@link #getString()}时解码并缓存
 *   <li>零拷贝接口：为受信任的内部路径（解码器、存储引擎）提供免拷贝访问
 * </ul>
 *
 * <p>线程安全性：本类是不可变的，可在连接之间安全共享。
 *
 * @since 1.0.0
 */
public final class KvBytes {

    /** 字符串编码解码使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 自动缓存字符串表示的最大长度 */
    private static final int MAX_CACHED_STRING_SIZE = 128;

    /** 预分配的空字节串实例 */
    public static final KvBytes EMPTY = new KvBytes(new byte[0], true);

    /** 存储的字节数组（不可变） */
    private final byte[] bytes;

    /** 预计算的哈希值 */
    private final int hashCode;

    /** 延迟初始化的字符串值 */
    private volatile String stringValue;

    /**
     * 创建不可变字节串实例，执行防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public KvBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private KvBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        // 1. 受信任的数组直接持有，否则拷贝一份
        this.bytes = trusted ? bytes : bytes.clone();
        // 2. 预计算哈希值
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 创建零拷贝实例。
     *
     * <p><b>警告</b>：调用者必须保证参数数组之后不再被修改！
     *
     * @param trustedBytes 受信任的字节数组
     * @return KvBytes实例，如果输入为null则返回null
     */
    public static KvBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new KvBytes(trustedBytes, true);
    }

    /**
     * 从UTF-8字符串创建实例。
     *
     * @param str 源字符串
     * @return KvBytes实例，如果输入为null则返回null
     */
    public static KvBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final KvBytes kvBytes = new KvBytes(str.getBytes(CHARSET), true);
        if (str.length() <= MAX_CACHED_STRING_SIZE) {
            kvBytes.stringValue = str;
        }
        return kvBytes;
    }

    /**
     * 获取字节数组的副本。
     *
     * @return 字节数组副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层字节数组的直接引用，仅用于只读场景（编码、写盘）。
     *
     * @return 底层字节数组，调用者不得修改
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 以UTF-8解码为字符串，结果会被缓存。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 大小写不敏感的比较，只折叠ASCII字母。
     *
     * @param other 另一个实例
     * @return 忽略大小写后是否相等
     */
    public boolean equalsIgnoreCase(final KvBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLowerAscii(bytes[i]) != toLowerAscii(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    private static byte toLowerAscii(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final KvBytes other = (KvBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        // 1. 只展示前16个字节，不可打印字符转义
        final StringBuilder sb = new StringBuilder("KvBytes[length=").append(bytes.length).append(", preview='");
        for (int i = 0; i < Math.min(bytes.length, 16); i++) {
            final byte b = bytes[i];
            if (b >= 32 && b <= 126) {
                sb.append((char) b);
            } else {
                sb.append("\\x").append(String.format("%02x", b & 0xFF));
            }
        }
        if (bytes.length > 16) {
            sb.append("...");
        }
        return sb.append("']").toString();
    }
}
