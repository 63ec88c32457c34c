package stagequeue.optimizer;

import stagequeue.model.Stage;
import stagequeue.model.StageConfig;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Chooses the optimizer for a stage of a factory.
 *
 * @see stagequeue.optimizer.process.ScriptOptimizerResolver
 */
@FunctionalInterface
public interface OptimizerResolver {

  /** Resolver that never returns an optimizer; every release uses FIFO order. */
  OptimizerResolver NONE = (factoryId, stage, config) -> null;

  /**
   * @param config the stage config at the start of the cycle
   * @return the optimizer, or {@code null} to release in FIFO order
   */
  Optimizer resolve(String factoryId, Stage stage, StageConfig config);

  /** Uses the same optimizer for every stage. */
  static OptimizerResolver of(Optimizer optimizer) {
    Objects.requireNonNull(optimizer, "optimizer");
    return (factoryId, stage, config) -> optimizer;
  }

  /** Uses one optimizer per stage; stages without an entry use FIFO order. */
  static OptimizerResolver perStage(Map<Stage, Optimizer> optimizers) {
    Map<Stage, Optimizer> copy = new EnumMap<>(Stage.class);
    copy.putAll(optimizers);
    return (factoryId, stage, config) -> copy.get(stage);
  }
}
