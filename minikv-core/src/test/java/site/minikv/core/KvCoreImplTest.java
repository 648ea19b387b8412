package site.minikv.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.minikv.datastructure.KvBytes;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("KvCoreImpl单元测试")
class KvCoreImplTest {

    private KvCoreImpl core;

    private static KvBytes b(final String s) {
        return KvBytes.fromString(s);
    }

    @BeforeEach
    void setUp() {
        core = new KvCoreImpl();
    }

    @Test
    @DisplayName("字符串写入、读取与覆盖")
    void stringSetGetOverwrite() {
        assertThat(core.stringGet(b("k"))).isNull();
        core.stringSet(b("k"), b("v1"));
        core.stringSet(b("k"), b("v2"));
        assertThat(core.stringGet(b("k"))).isEqualTo(b("v2"));
        assertThat(core.stringSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("哈希字段写入与读取")
    void hashSetGet() {
        core.hashSet(b("h"), b("f1"), b("a"));
        core.hashSet(b("h"), b("f2"), b("b"));
        core.hashSet(b("h"), b("f1"), b("c"));

        assertThat(core.hashGet(b("h"), b("f1"))).isEqualTo(b("c"));
        assertThat(core.hashGet(b("h"), b("missing"))).isNull();
        assertThat(core.hashGet(b("nohash"), b("f1"))).isNull();
        assertThat(core.hashGetAll(b("h"))).containsOnlyKeys(b("f1"), b("f2"));
    }

    @Test
    @DisplayName("字符串与哈希命名空间互相独立")
    void namespacesAreIndependent() {
        core.stringSet(b("x"), b("1"));
        core.hashSet(b("x"), b("f"), b("2"));

        assertThat(core.stringGet(b("x"))).isEqualTo(b("1"));
        assertThat(core.hashGet(b("x"), b("f"))).isEqualTo(b("2"));
    }

    @Test
    @DisplayName("hashGetAll返回不可修改的快照")
    void hashGetAllSnapshot() {
        core.hashSet(b("h"), b("f"), b("v"));
        final Map<KvBytes, KvBytes> snapshot = core.hashGetAll(b("h"));
        core.hashSet(b("h"), b("g"), b("w"));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.put(b("z"), b("z")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(core.hashGetAll(b("none"))).isEmpty();
    }

    @Test
    @DisplayName("并发写入不丢失数据")
    void concurrentWrites() throws InterruptedException {
        final int threads = 8;
        final int perThread = 500;
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);
        final CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            final int id = t;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        core.stringSet(b("k-" + id + "-" + i), b("v"));
                        core.hashSet(b("h"), b("f-" + id + "-" + i), b("v"));
                        core.stringGet(b("k-" + id + "-" + i));
                        core.hashGet(b("h"), b("f-" + id + "-" + i));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(core.stringSize()).isEqualTo(threads * perThread);
        assertThat(core.hashGetAll(b("h"))).hasSize(threads * perThread);
    }
}
