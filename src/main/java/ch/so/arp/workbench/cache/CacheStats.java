package ch.so.arp.workbench.cache;

/**
 * Hit and miss counters of a {@link ResponseCache} at one point in time.
 */
public record CacheStats(long hits, long misses) {

    public static final CacheStats EMPTY = new CacheStats(0L, 0L);
}
