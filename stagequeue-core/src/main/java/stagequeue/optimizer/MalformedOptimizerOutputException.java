package stagequeue.optimizer;

/**
 * Optimizer output that cannot be parsed or violates the result schema.
 */
public final class MalformedOptimizerOutputException extends OptimizerException {
  public MalformedOptimizerOutputException(String message) {
    super(message);
  }

  public MalformedOptimizerOutputException(String message, Throwable cause) {
    super(message, cause);
  }
}
