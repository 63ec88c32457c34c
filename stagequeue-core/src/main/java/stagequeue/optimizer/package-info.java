/**
 * Optimizer contract and the bridge that calls it under a timeout.
 *
 * <p>An {@link stagequeue.optimizer.Optimizer} sees the full pending pool of one stage and
 * may answer with a ranking, batches, ETAs and hold decisions. Failures never propagate:
 * {@link stagequeue.optimizer.OptimizerBridge} turns them into a FIFO fallback.
 */
package stagequeue.optimizer;
