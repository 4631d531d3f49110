package space.ketterling.liveview.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Runs a task up to {@code maxRetries} times with exponential backoff.
 *
 * <p>
 * After failed attempt {@code i} (0-based) it sleeps {@code baseDelayMs * 2^i}
 * before trying again; there is no sleep after the last attempt. Exhaustion is
 * reported through a callback and a {@code null} result, never by throwing.
 * </p>
 */
public class RetryWrapper {
    private static final Logger log = LoggerFactory.getLogger(RetryWrapper.class);

    /**
     * Pluggable sleep so tests can record delays instead of waiting.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxRetries;
    private final long baseDelayMs;
    private final Sleeper sleeper;

    public RetryWrapper(int maxRetries, long baseDelayMs) {
        this(maxRetries, baseDelayMs, Thread::sleep);
    }

    public RetryWrapper(int maxRetries, long baseDelayMs, Sleeper sleeper) {
        if (maxRetries < 1)
            throw new IllegalArgumentException("maxRetries must be >= 1");
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.sleeper = sleeper;
    }

    public <T> T execute(String name, Callable<T> task) {
        return execute(name, task, e -> {
        });
    }

    /**
     * Returns the first successful result, or {@code null} once every attempt
     * failed (or the thread was interrupted), after passing the last error to
     * {@code onExhausted}.
     */
    public <T> T execute(String name, Callable<T> task, Consumer<Exception> onExhausted) {
        Exception last = null;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return task.call();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted on attempt {}", name, attempt + 1);
                onExhausted.accept(ie);
                return null;
            } catch (Exception e) {
                last = e;
                if (attempt < maxRetries - 1) {
                    long delay = baseDelayMs * (1L << attempt);
                    log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                            name, attempt + 1, maxRetries, delay, e.toString());
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        log.warn("{} interrupted while backing off", name);
                        onExhausted.accept(e);
                        return null;
                    }
                }
            }
        }
        log.error("{} failed after {} attempts", name, maxRetries, last);
        onExhausted.accept(last);
        return null;
    }
}
