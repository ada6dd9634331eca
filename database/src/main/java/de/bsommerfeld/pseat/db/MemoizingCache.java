package de.bsommerfeld.pseat.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;

/**
 * Unbounded read-through cache for one lookup operation. Entries live until
 * they are explicitly invalidated; there is no size or time based eviction.
 *
 * <h3>Coherence</h3>
 * A miss installs a pending {@link Load} for its key and runs the loader
 * outside the map, so a slow store read never blocks other keys. Concurrent
 * readers of the same key wait for that load instead of starting their own.
 * {@link #invalidate} detaches the key's load, finished or not. A load that
 * was in flight keeps serving the readers already waiting on it, but a read
 * issued after the invalidation starts a fresh one. Once a writer has stored
 * a new row and invalidated the key, no later read can get the value loaded
 * before the write.
 *
 * <h3>Absent results</h3>
 * Values must not be {@code null}. Callers that need to remember "no row"
 * cache an {@link java.util.Optional} instead.
 *
 * <h3>Failures</h3>
 * Loader exceptions propagate unchanged, also to readers waiting on the same
 * load, and nothing is cached. Any other failure of the cache's own
 * bookkeeping, including a loader that re-enters the cache for the key it is
 * loading, is logged and answered by calling the loader directly. A broken
 * cache costs performance but never a result.
 *
 * @param <K> lookup key, must implement value equality
 * @param <V> cached value
 */
public final class MemoizingCache<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(MemoizingCache.class);

    private final String name;
    private final ConcurrentHashMap<K, Load<V>> entries = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public MemoizingCache(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Returns the cached value for {@code key}, loading and storing it on a
     * miss.
     *
     * @param loader reads the value from the store; must not return
     *               {@code null}
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        Load<V> current;
        try {
            current = entries.get(key);
            if (current == null) {
                Load<V> fresh = new Load<>();
                current = entries.putIfAbsent(key, fresh);
                if (current == null)
                    return load(key, fresh, loader);
            }
        } catch (RuntimeException e) {
            return readThrough(key, loader, e);
        }

        if (current.owner == Thread.currentThread()) {
            return readThrough(key, loader, new IllegalStateException("Recursive load of " + key));
        }

        V value = await(current);
        hits.increment();
        return value;
    }

    /**
     * Evicts the entry for {@code key}. A load still in flight for it completes
     * for its current waiters but is no longer reachable from the cache.
     */
    public void invalidate(K key) {
        if (entries.remove(key) != null) {
            LOG.debug("Cache '{}' evicted {}", name, key);
        }
    }

    public void clear() {
        entries.clear();
    }

    /** Returns true if a value for {@code key} is held or being loaded. */
    public boolean contains(K key) {
        return entries.containsKey(key);
    }

    public CacheStats stats() {
        return new CacheStats(hits.sum(), misses.sum(), entries.size());
    }

    private V load(K key, Load<V> load, Function<? super K, ? extends V> loader) {
        misses.increment();
        try {
            V value = Objects.requireNonNull(loader.apply(key), "loader returned null for " + key);
            load.result.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            entries.remove(key, load);
            load.result.completeExceptionally(e);
            throw e;
        } finally {
            load.owner = null;
        }
    }

    private V readThrough(K key, Function<? super K, ? extends V> loader, RuntimeException fault) {
        LOG.warn("Cache '{}' failed for key {}, reading through to the store", name, key, fault);
        misses.increment();
        return Objects.requireNonNull(loader.apply(key), "loader returned null for " + key);
    }

    private static <V> V await(Load<V> load) {
        try {
            return load.result.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw e;
        }
    }

    /** One load of one key, shared by every reader that finds it in the map. */
    private static final class Load<V> {
        final CompletableFuture<V> result = new CompletableFuture<>();
        volatile Thread owner = Thread.currentThread();
    }
}
