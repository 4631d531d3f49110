package space.ketterling.liveview.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Holds one value that is replaced wholesale once its time to live passes.
 */
public final class SnapshotCache<T> {
    private final Duration ttl;
    private final Clock clock;

    private T value;
    private long fetchedAtMs;

    public SnapshotCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public SnapshotCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the current value, reloading it when absent or stale. A loader
     * failure propagates and keeps the previous state.
     */
    public T get(Callable<T> loader) throws Exception {
        synchronized (this) {
            if (value != null && clock.millis() - fetchedAtMs < ttl.toMillis())
                return value;
        }
        T fresh = loader.call();
        synchronized (this) {
            value = fresh;
            fetchedAtMs = clock.millis();
        }
        return fresh;
    }

    public synchronized boolean isFresh() {
        return value != null && clock.millis() - fetchedAtMs < ttl.toMillis();
    }

    public synchronized void clear() {
        value = null;
        fetchedAtMs = 0L;
    }
}
