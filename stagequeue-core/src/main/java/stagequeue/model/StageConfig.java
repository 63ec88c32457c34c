package stagequeue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-factory, per-stage release settings and the open batch-window marker.
 *
 * @param releaseAfterMinutes  batch window length; {@code 0} releases immediately
 * @param batchStartSimMinute  start of the open window, {@code null} when closed
 * @param optimizerScript      optional optimizer script path for this stage
 */
public record StageConfig(
    String factoryId,
    Stage stage,
    int releaseAfterMinutes,
    Long batchStartSimMinute,
    String optimizerScript,
    Instant updatedAt
) {
  public StageConfig {
    Objects.requireNonNull(factoryId, "factoryId");
    Objects.requireNonNull(stage, "stage");
    if (releaseAfterMinutes < 0) {
      throw new IllegalArgumentException("releaseAfterMinutes must be >= 0");
    }
  }

  public static StageConfig defaults(String factoryId, Stage stage) {
    return new StageConfig(factoryId, stage, 0, null, null, null);
  }

  public boolean isImmediate() {
    return releaseAfterMinutes == 0;
  }

  public boolean isWindowOpen() {
    return batchStartSimMinute != null;
  }
}
