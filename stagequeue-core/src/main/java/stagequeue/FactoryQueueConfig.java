package stagequeue;

import stagequeue.model.Stage;
import stagequeue.model.StageConfig;

import java.util.Map;

/**
 * The stage configs of one factory, one entry per {@link Stage}.
 */
public record FactoryQueueConfig(String factoryId, Map<Stage, StageConfig> stages) {
  public FactoryQueueConfig {
    stages = Map.copyOf(stages);
  }

  public StageConfig stage(Stage stage) {
    return stages.get(stage);
  }
}
