package site.minikv.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KvBytes 单元测试")
class KvBytesTest {

    @Nested
    @DisplayName("构造与工厂方法")
    class FactoryTests {

        @Test
        @DisplayName("构造函数执行防御性拷贝")
        void testConstructorCopies() {
            final byte[] source = "hello".getBytes(KvBytes.CHARSET);
            final KvBytes kvBytes = new KvBytes(source);
            source[0] = 'j';

            assertEquals("hello", kvBytes.getString());
        }

        @Test
        @DisplayName("wrapTrusted不拷贝数组")
        void testWrapTrustedSharesArray() {
            final byte[] source = "abc".getBytes(KvBytes.CHARSET);
            final KvBytes kvBytes = KvBytes.wrapTrusted(source);

            assertSame(source, kvBytes.getBytesUnsafe());
            assertNull(KvBytes.wrapTrusted(null));
        }

        @Test
        @DisplayName("null字节数组被拒绝")
        void testNullRejected() {
            assertThrows(IllegalArgumentException.class, () -> new KvBytes(null));
        }

        @Test
        @DisplayName("空字符串返回EMPTY常量")
        void testEmptyString() {
            assertSame(KvBytes.EMPTY, KvBytes.fromString(""));
            assertTrue(KvBytes.EMPTY.isEmpty());
            assertNull(KvBytes.fromString(null));
        }

        @Test
        @DisplayName("getBytes返回副本")
        void testGetBytesReturnsCopy() {
            final KvBytes kvBytes = KvBytes.fromString("value");
            kvBytes.getBytes()[0] = 'X';

            assertEquals("value", kvBytes.getString());
        }
    }

    @Nested
    @DisplayName("比较操作")
    class ComparisonTests {

        @Test
        @DisplayName("内容相同即相等，可作为Map键")
        void testEqualsAndHashCode() {
            final KvBytes a = KvBytes.fromString("key");
            final KvBytes b = new KvBytes("key".getBytes(KvBytes.CHARSET));

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());

            final Map<KvBytes, String> map = new HashMap<>();
            map.put(a, "v");
            assertEquals("v", map.get(b));
        }

        @Test
        @DisplayName("大小写不敏感比较只折叠ASCII字母")
        void testEqualsIgnoreCase() {
            assertTrue(KvBytes.fromString("hset").equalsIgnoreCase(KvBytes.fromString("HSet")));
            assertFalse(KvBytes.fromString("get").equalsIgnoreCase(KvBytes.fromString("set")));
            assertFalse(KvBytes.fromString("get").equalsIgnoreCase(KvBytes.fromString("gets")));
            assertFalse(KvBytes.fromString("get").equalsIgnoreCase(null));
        }
    }

    @Test
    @DisplayName("toString转义不可打印字节")
    void testToStringEscapesBinary() {
        final KvBytes kvBytes = new KvBytes(new byte[]{'a', '\r', '\n'});

        assertEquals("KvBytes[length=3, preview='a\\x0d\\x0a']", kvBytes.toString());
    }
}
