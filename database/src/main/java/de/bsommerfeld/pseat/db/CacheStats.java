package de.bsommerfeld.pseat.db;

/**
 * Point-in-time counters of a {@link MemoizingCache}. Hits and misses are
 * cumulative over the cache's life and are not reset by invalidation.
 *
 * @param hits   lookups answered from memory
 * @param misses lookups that went to the store, including failed ones
 * @param size   entries currently held
 */
public record CacheStats(long hits, long misses, int size) {

    public long requestCount() {
        return hits + misses;
    }
}
