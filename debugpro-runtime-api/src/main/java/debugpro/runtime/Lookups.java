package debugpro.runtime;

import java.util.Map;

/**
 * 严格的映射访问：键不存在时抛出 {@link KeyLookupException}，而不是返回 null。
 */
public final class Lookups {

    private Lookups() {}

    public static <K, V> V get(Map<K, V> map, Object key) {
        if (!map.containsKey(key)) {
            throw new KeyLookupException(key);
        }
        return map.get(key);
    }
}
