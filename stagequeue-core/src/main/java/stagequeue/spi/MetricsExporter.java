package stagequeue.spi;

import stagequeue.model.Stage;

/**
 * Observability hook for exporting scheduler counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see stagequeue.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of entries inserted into a stage queue.
     */
    void incrementEnqueued(Stage stage);

    /**
     * Increments the count of enqueue calls skipped because the order was already pending.
     */
    void incrementEnqueueSkipped(Stage stage);

    /**
     * Adds to the count of entries released from a stage queue.
     *
     * @param count number of entries released by one cycle
     */
    void incrementReleased(Stage stage, int count);

    /**
     * Increments the count of optimizer calls that failed, timed out or returned malformed output.
     */
    void incrementOptimizerFailure(Stage stage);

    /**
     * Increments the count of delivery-date writes that failed.
     */
    default void incrementEtaWriteFailure(Stage stage) {
    }

    /**
     * Increments the count of release cycles aborted by a persistence failure.
     */
    default void incrementPersistenceFailure(Stage stage) {
    }

    /**
     * Increments the count of optimizer results discarded because the batch window
     * changed while the optimizer was running.
     */
    default void incrementStaleResultDiscarded(Stage stage) {
    }

    /**
     * Records the optimizer wall-clock duration.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordOptimizerDurationMs(Stage stage, long durationMs) {
    }

    /**
     * Records the current depth of a stage queue after a release cycle.
     *
     * @param pending number of pending entries
     * @param onHold  number of pending entries currently on hold
     */
    void recordQueueDepth(Stage stage, int pending, int onHold);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued(Stage stage) {
        }

        @Override
        public void incrementEnqueueSkipped(Stage stage) {
        }

        @Override
        public void incrementReleased(Stage stage, int count) {
        }

        @Override
        public void incrementOptimizerFailure(Stage stage) {
        }

        @Override
        public void recordQueueDepth(Stage stage, int pending, int onHold) {
        }
    }
}
