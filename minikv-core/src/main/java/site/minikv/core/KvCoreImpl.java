package site.minikv.core;

import lombok.extern.slf4j.Slf4j;
import site.minikv.datastructure.KvBytes;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 键值存储核心实现
 *
 * <h2>线程安全设计：</h2>
 * <ul>
 *     <li>字符串表和哈希表各自持有一把读写锁，读操作共享、写操作独占</li>
 *     <li>任何操作只持有其中一把锁，不存在锁嵌套</li>
 *     <li>哈希的内层映射只在哈希表锁内访问，对外只返回副本</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
public class KvCoreImpl implements KvCore {

    private final Map<KvBytes, KvBytes> strings = new HashMap<>();
    private final ReentrantReadWriteLock stringsLock = new ReentrantReadWriteLock();

    private final Map<KvBytes, Map<KvBytes, KvBytes>> hashes = new HashMap<>();
    private final ReentrantReadWriteLock hashesLock = new ReentrantReadWriteLock();

    @Override
    public void stringSet(final KvBytes key, final KvBytes value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        stringsLock.writeLock().lock();
        try {
            strings.put(key, value);
        } finally {
            stringsLock.writeLock().unlock();
        }
    }

    @Override
    public KvBytes stringGet(final KvBytes key) {
        stringsLock.readLock().lock();
        try {
            return strings.get(key);
        } finally {
            stringsLock.readLock().unlock();
        }
    }

    @Override
    public void hashSet(final KvBytes hash, final KvBytes field, final KvBytes value) {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        hashesLock.writeLock().lock();
        try {
            // 1. 哈希不存在时先创建，再写入字段
            hashes.computeIfAbsent(hash, k -> {
                log.debug("创建哈希: {}", k);
                return new HashMap<>();
            }).put(field, value);
        } finally {
            hashesLock.writeLock().unlock();
        }
    }

    @Override
    public KvBytes hashGet(final KvBytes hash, final KvBytes field) {
        hashesLock.readLock().lock();
        try {
            final Map<KvBytes, KvBytes> fields = hashes.get(hash);
            return fields == null ? null : fields.get(field);
        } finally {
            hashesLock.readLock().unlock();
        }
    }

    @Override
    public Map<KvBytes, KvBytes> hashGetAll(final KvBytes hash) {
        hashesLock.readLock().lock();
        try {
            final Map<KvBytes, KvBytes> fields = hashes.get(hash);
            if (fields == null) {
                return Collections.emptyMap();
            }
            return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        } finally {
            hashesLock.readLock().unlock();
        }
    }

    @Override
    public int stringSize() {
        stringsLock.readLock().lock();
        try {
            return strings.size();
        } finally {
            stringsLock.readLock().unlock();
        }
    }
}
