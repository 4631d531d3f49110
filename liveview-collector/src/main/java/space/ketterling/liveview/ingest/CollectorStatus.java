package space.ketterling.liveview.ingest;

import java.time.Instant;

/**
 * Point-in-time view of one collector. {@code lastResult} is null when the
 * last run failed or none has completed yet.
 */
public record CollectorStatus(Instant lastRun, Integer lastResult, String lastError, Instant nextRun) {
}
