package space.ketterling.liveview.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each collector on its own fixed cadence.
 *
 * <p>
 * A single ticker thread fires the cadences and hands every run to a worker
 * pool, so a slow collector never delays another. Runs go through the
 * {@link RetryWrapper}; a failing collector is recorded in its status and
 * tried again on its next tick. A run that is still in flight when its next
 * tick fires causes that tick to be skipped.
 * </p>
 */
public final class CollectorScheduler {
    private static final Logger log = LoggerFactory.getLogger(CollectorScheduler.class);

    /**
     * One row of the schedule table.
     */
    public record ScheduledCollector(Collector collector, Duration interval) {
    }

    /**
     * Snapshot returned by {@link #status()}.
     */
    public record SchedulerStatus(boolean enabled, Map<String, CollectorStatus> collectors) {
    }

    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final RetryWrapper retry;
    private final boolean enabled;
    private final Duration startupDelay;
    private final Clock clock;

    private ScheduledExecutorService ticker;
    private volatile ExecutorService workers;
    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();
    private boolean running;

    public CollectorScheduler(List<ScheduledCollector> table, RetryWrapper retry, boolean enabled,
            Duration startupDelay, Clock clock) {
        for (ScheduledCollector sc : table) {
            if (slots.putIfAbsent(sc.collector().name(), new Slot(sc)) != null)
                throw new IllegalArgumentException("Duplicate collector name: " + sc.collector().name());
        }
        this.retry = retry;
        this.enabled = enabled;
        this.startupDelay = startupDelay;
        this.clock = clock;
    }

    /**
     * Starts the cadences and schedules one warm-up pass after the startup
     * delay. Returns false (and does nothing) when collection is disabled or
     * persistence is not configured.
     */
    public synchronized boolean start() {
        if (!enabled) {
            log.info("Collector scheduler disabled");
            return false;
        }
        if (running) {
            log.debug("Collector scheduler already running");
            return true;
        }

        ticker = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "collector-ticker"));
        AtomicInteger n = new AtomicInteger();
        workers = Executors.newFixedThreadPool(Math.max(1, slots.size()),
                r -> daemon(r, "collector-" + n.incrementAndGet()));

        Instant now = clock.instant();
        for (Slot slot : slots.values()) {
            long ms = slot.interval.toMillis();
            slot.nextRun = now.plus(slot.interval);
            tasks.add(ticker.scheduleAtFixedRate(() -> dispatch(slot), ms, ms, TimeUnit.MILLISECONDS));
        }
        tasks.add(ticker.schedule(this::dispatchWarmUp, startupDelay.toMillis(), TimeUnit.MILLISECONDS));

        running = true;
        log.info("Collector scheduler started with {} collectors", slots.size());
        return true;
    }

    /**
     * Cancels all cadences and shuts the executors down. Safe to call more than
     * once or before {@link #start()}.
     */
    public synchronized void stop() {
        if (!running)
            return;
        for (ScheduledFuture<?> f : tasks)
            f.cancel(true);
        tasks.clear();
        shutdown(ticker, "ticker");
        shutdown(workers, "workers");
        ticker = null;
        workers = null;
        running = false;
        log.info("Collector scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public SchedulerStatus status() {
        Map<String, CollectorStatus> out = new LinkedHashMap<>();
        slots.forEach((name, slot) -> out.put(name, slot.snapshot()));
        return new SchedulerStatus(enabled, out);
    }

    /**
     * Runs one collector on the calling thread, as a tick would. Returns false
     * when that collector is unknown or already running.
     */
    public boolean runNow(String name) {
        Slot slot = slots.get(name);
        if (slot == null)
            return false;
        return runGuarded(slot);
    }

    private void dispatch(Slot slot) {
        slot.nextRun = clock.instant().plus(slot.interval);
        submit(() -> runGuarded(slot));
    }

    private void dispatchWarmUp() {
        submit(() -> {
            log.info("Running startup pass over {} collectors", slots.size());
            for (Slot slot : slots.values()) {
                if (Thread.currentThread().isInterrupted())
                    return;
                runGuarded(slot);
            }
        });
    }

    private void submit(Runnable r) {
        ExecutorService pool = workers;
        if (pool == null)
            return;
        try {
            pool.execute(r);
        } catch (RejectedExecutionException e) {
            log.debug("Run rejected, scheduler is stopping");
        }
    }

    private boolean runGuarded(Slot slot) {
        String name = slot.collector.name();
        if (!slot.inFlight.compareAndSet(false, true)) {
            log.warn("Collector {} still running, skipping this run", name);
            return false;
        }
        MDC.put("job", name);
        try {
            String[] error = new String[1];
            Integer result = retry.execute(name, slot.collector::collect, e -> error[0] = describe(e));
            slot.record(clock.instant(), result, result == null ? error[0] : null);
            if (result != null)
                log.debug("Collector {} processed {} items", name, result);
        } catch (RuntimeException e) {
            log.error("Collector {} crashed", name, e);
            slot.record(clock.instant(), null, describe(e));
        } finally {
            MDC.remove("job");
            slot.inFlight.set(false);
        }
        return true;
    }

    private static String describe(Exception e) {
        if (e == null)
            return "unknown error";
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    private void shutdown(ExecutorService es, String name) {
        if (es == null)
            return;
        es.shutdownNow();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping {}", name);
        }
    }

    private static final class Slot {
        private final Collector collector;
        private final Duration interval;
        private final AtomicBoolean inFlight = new AtomicBoolean();

        private volatile Instant nextRun;
        private Instant lastRun;
        private Integer lastResult;
        private String lastError;

        private Slot(ScheduledCollector sc) {
            this.collector = sc.collector();
            this.interval = sc.interval();
        }

        private synchronized void record(Instant at, Integer result, String error) {
            lastRun = at;
            lastResult = result;
            lastError = error;
        }

        private synchronized CollectorStatus snapshot() {
            return new CollectorStatus(lastRun, lastResult, lastError, nextRun);
        }
    }
}
