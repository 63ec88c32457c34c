package stagequeue.optimizer;

/**
 * What one optimizer invocation produced.
 *
 * @param optimizer  the optimizer's name, {@code null} if none was configured
 * @param result     the validated result, or {@code null} on failure or when no optimizer ran
 * @param failure    failure description, {@code null} on success
 * @param durationMs wall-clock duration of the call
 */
public record OptimizerOutcome(String optimizer, OptimizerResult result, String failure,
    long durationMs) {

  public static OptimizerOutcome notConfigured() {
    return new OptimizerOutcome(null, null, null, 0);
  }

  public boolean hasResult() {
    return result != null;
  }

  public boolean failed() {
    return failure != null;
  }
}
