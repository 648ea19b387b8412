package site.minikv.core;

import site.minikv.datastructure.KvBytes;

import java.util.Map;

/**
 * 键值存储核心操作接口
 *
 * <p>维护两个互相独立的命名空间：
 * <ul>
 *     <li>字符串命名空间 - key到value的映射</li>
 *     <li>哈希命名空间 - hash名到(field到value)映射的映射</li>
 * </ul>
 * 同名的字符串键和哈希键互不影响。所有操作都是线程安全的，单个操作对其他线程原子可见。
 *
 * @since 1.0.0
 */
public interface KvCore {

    /**
     * 设置字符串键的值，已存在则覆盖
     *
     * @param key 键
     * @param value 值
     */
    void stringSet(KvBytes key, KvBytes value);

    /**
     * 获取字符串键的值
     *
     * @param key 键
     * @return 对应的值，不存在时返回null
     */
    KvBytes stringGet(KvBytes key);

    /**
     * 设置哈希字段的值，哈希不存在时自动创建
     *
     * @param hash 哈希名
     * @param field 字段名
     * @param value 值
     */
    void hashSet(KvBytes hash, KvBytes field, KvBytes value);

    /**
     * 获取哈希字段的值
     *
     * @return 字段值，哈希或字段不存在时返回null
     */
    KvBytes hashGet(KvBytes hash, KvBytes field);

    /**
     * 获取整个哈希的快照
     *
     * @param hash 哈希名
     * @return 字段到值的不可变副本，哈希不存在时返回空映射
     */
    Map<KvBytes, KvBytes> hashGetAll(KvBytes hash);

    /**
     * @return 字符串键的数量
     */
    int stringSize();
}
