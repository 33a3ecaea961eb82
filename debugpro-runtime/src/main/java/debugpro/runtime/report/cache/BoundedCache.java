package debugpro.runtime.report.cache;

import java.util.function.Function;

/**
 * 有界缓存接口（源码文件读取缓存使用）。
 */
public interface BoundedCache<K, V> {

    /** 缓存值，不存在返回 null */
    V get(K key);

    /**
     * 不存在时计算并缓存。
     *
     * @param loader 计算函数，返回 null 时不缓存
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> loader);

    long size();

    CacheStats getStats();
}
