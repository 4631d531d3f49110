package space.ketterling.liveview.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Capacity-bounded key/value cache with a per-entry time to live.
 *
 * <p>
 * Eviction is first-in-first-out: when full, the entry inserted longest ago is
 * dropped, no matter how recently it was read. A hit never refreshes an
 * entry's deadline or its position. Expired entries are removed lazily on
 * access and by {@link #sweepExpired()}.
 * </p>
 *
 * <p>
 * Loaders run outside the lock, so two threads missing on the same key both
 * call upstream and the later insert replaces the earlier one.
 * </p>
 */
public final class BoundedTtlCache<K, V> {

    /**
     * Upstream lookup used on a miss.
     */
    @FunctionalInterface
    public interface Loader<K, V> {
        V load(K key) throws Exception;
    }

    private final String name;
    private final int maxSize;
    private final Duration ttl;
    private final Clock clock;

    // insertion-ordered; access order is deliberately not used
    private final LinkedHashMap<K, Entry<V>> entries = new LinkedHashMap<>();

    public BoundedTtlCache(String name, int maxSize, Duration ttl) {
        this(name, maxSize, ttl, Clock.systemUTC());
    }

    public BoundedTtlCache(String name, int maxSize, Duration ttl, Clock clock) {
        if (maxSize < 1)
            throw new IllegalArgumentException("maxSize must be >= 1, got " + maxSize);
        if (ttl.isNegative() || ttl.isZero())
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        this.name = Objects.requireNonNull(name, "name");
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the cached value for {@code key}, or loads, stores and returns it.
     * A loader failure propagates and leaves the cache untouched.
     */
    public V getOrFetch(K key, Loader<? super K, ? extends V> loader) throws Exception {
        V cached = getIfPresent(key);
        if (cached != null)
            return cached;

        V loaded = loader.load(key);
        if (loaded == null)
            return null;
        put(key, loaded);
        return loaded;
    }

    /**
     * Returns a live value without loading, or null.
     */
    public synchronized V getIfPresent(K key) {
        Entry<V> e = entries.get(key);
        if (e == null)
            return null;
        if (e.expiresAtMs <= clock.millis()) {
            entries.remove(key);
            return null;
        }
        return e.value;
    }

    private synchronized void put(K key, V value) {
        // a replaced key is re-inserted at the tail with a fresh deadline
        entries.remove(key);
        while (entries.size() >= maxSize) {
            Iterator<K> oldest = entries.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        entries.put(key, new Entry<>(value, clock.millis() + ttl.toMillis()));
    }

    /**
     * Drops every expired entry and returns how many were removed.
     */
    public synchronized int sweepExpired() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<K, Entry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().expiresAtMs <= now) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Keys in insertion order, oldest first. Includes not-yet-swept expired keys.
     */
    public synchronized List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized Stats stats() {
        return new Stats(name, entries.size(), maxSize, ttl.toMillis());
    }

    public String name() {
        return name;
    }

    /**
     * Point-in-time cache statistics.
     */
    public record Stats(String name, int size, int maxSize, long ttlMs) {
    }

    private static final class Entry<V> {
        final V value;
        final long expiresAtMs;

        Entry(V value, long expiresAtMs) {
            this.value = value;
            this.expiresAtMs = expiresAtMs;
        }
    }
}
