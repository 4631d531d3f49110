package space.ketterling.liveview.ingest;

/**
 * One historical collector: fetch a snapshot, reconcile it with the database,
 * return how many items were processed.
 */
public interface Collector {

    /**
     * Stable name used for scheduling, status and logging.
     */
    String name();

    /**
     * Runs one cycle. Returns 0 without any I/O when persistence is not
     * configured; throws only when the cycle as a whole failed.
     */
    int collect() throws Exception;
}
