package stagequeue.optimizer;

/**
 * Thrown by an {@link Optimizer} that could not produce a result.
 */
public class OptimizerException extends RuntimeException {
  public OptimizerException(String message) {
    super(message);
  }

  public OptimizerException(String message, Throwable cause) {
    super(message, cause);
  }
}
