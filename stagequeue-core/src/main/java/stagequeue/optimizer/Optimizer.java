package stagequeue.optimizer;

/**
 * Pluggable reordering-and-annotation function for a stage's pending pool.
 *
 * <p>Implementations may be slow or fail. {@link OptimizerBridge} bounds every call by a
 * timeout and turns any exception into a FIFO fallback.
 *
 * @see stagequeue.optimizer.process.ProcessOptimizer
 */
public interface Optimizer {

  /**
   * Identity recorded on delivery-date records and scheduling log entries.
   */
  String name();

  /**
   * Computes a result for the given pool.
   *
   * @return the result; {@code null} is treated as an empty result (no opinion)
   * @throws Exception on any failure
   */
  OptimizerResult optimize(OptimizerRequest request) throws Exception;
}
