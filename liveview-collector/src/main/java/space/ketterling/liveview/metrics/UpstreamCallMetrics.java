package space.ketterling.liveview.metrics;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks success/failure counts for upstream feed calls (NWS, USGS, VT511).
 *
 * <p>
 * Uses a rolling 60-minute window to compute basic health status.
 * </p>
 */
public final class UpstreamCallMetrics {
    private static final int WINDOW_MINUTES = 60;

    private final Map<String, MinuteBuckets> sources = new ConcurrentHashMap<>();
    private final Clock clock;

    public UpstreamCallMetrics() {
        this(Clock.systemUTC());
    }

    public UpstreamCallMetrics(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records one call outcome for a named upstream source.
     */
    public void record(String source, boolean success) {
        if (source == null || source.isBlank())
            return;
        sources.computeIfAbsent(source, k -> new MinuteBuckets()).record(currentMinute(), success);
    }

    /**
     * Returns call counts and failure rates per source, sorted by name.
     */
    public Map<String, SourceSnapshot> snapshot() {
        long nowMin = currentMinute();
        Map<String, SourceSnapshot> out = new TreeMap<>();
        sources.forEach((name, buckets) -> out.put(name, buckets.snapshot(nowMin)));
        return out;
    }

    public int windowMinutes() {
        return WINDOW_MINUTES;
    }

    private long currentMinute() {
        return clock.millis() / 60_000L;
    }

    /**
     * Summary for a single upstream source over the last window.
     */
    public record SourceSnapshot(long calls, long failures, double failurePct, String status) {
    }

    /**
     * Ring buffer of per-minute counts.
     */
    private static final class MinuteBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(long nowMin, boolean success) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
            }
            total[idx]++;
            if (!success)
                fail[idx]++;
        }

        private synchronized SourceSnapshot snapshot(long nowMin) {
            long calls = 0L;
            long failures = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (minute[i] == 0L || nowMin - minute[i] >= WINDOW_MINUTES)
                    continue;
                calls += total[i];
                failures += fail[i];
            }
            double pct = calls == 0 ? 0.0 : (failures * 100.0) / calls;
            String status;
            if (calls == 0) {
                status = "no-data";
            } else if (pct >= 50.0) {
                status = "down";
            } else if (pct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new SourceSnapshot(calls, failures, pct, status);
        }
    }
}
