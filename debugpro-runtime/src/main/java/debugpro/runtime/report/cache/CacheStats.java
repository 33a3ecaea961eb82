package debugpro.runtime.report.cache;

/**
 * 缓存统计快照
 */
public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long loadCount;
    private final long estimatedSize;

    public CacheStats(long hitCount, long missCount, long loadCount, long estimatedSize) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.loadCount = loadCount;
        this.estimatedSize = estimatedSize;
    }

    public long getHitCount() { return hitCount; }
    public long getMissCount() { return missCount; }
    public long getLoadCount() { return loadCount; }
    public long getEstimatedSize() { return estimatedSize; }

    @Override
    public String toString() {
        return String.format("hits=%d, misses=%d, loads=%d, size=%d",
                hitCount, missCount, loadCount, estimatedSize);
    }
}
