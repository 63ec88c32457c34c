package stagequeue.optimizer;

import stagequeue.model.Stage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of one optimizer call: the full pending pool of a stage plus stage configuration.
 *
 * @param orders pending entries in FIFO order
 * @param config release settings merged over the scheduler-wide optimizer settings
 */
public record OptimizerRequest(
    String factoryId,
    Stage stage,
    long nowSimMinute,
    List<OptimizerOrder> orders,
    Map<String, Object> config
) {

  /** Settings sent to every optimizer unless the scheduler is configured otherwise. */
  public static final Map<String, Object> DEFAULT_SETTINGS = defaultSettings();

  public OptimizerRequest {
    Objects.requireNonNull(stage, "stage");
    orders = List.copyOf(orders);
    config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
  }

  private static Map<String, Object> defaultSettings() {
    Map<String, Object> batchPolicy = new LinkedHashMap<>();
    batchPolicy.put("qMin", 3);
    batchPolicy.put("qMax", 7);
    batchPolicy.put("horizonMinutes", 240);
    Map<String, Object> settings = new LinkedHashMap<>();
    settings.put("mode", "INTEGRATED");
    settings.put("schedIntervalMinutes", 30);
    settings.put("batchPolicy", Collections.unmodifiableMap(batchPolicy));
    settings.put("tardinessWeight", 1.0);
    settings.put("varianceWeight", 0.1);
    settings.put("cvarAlpha", 0.9);
    settings.put("poissonLambda", 4.0);
    return Collections.unmodifiableMap(settings);
  }
}
