package stagequeue.optimizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One pending work item as seen by the optimizer.
 *
 * @param possibleSequence opaque JSON payload, forwarded untouched
 * @param processTimes     opaque JSON payload, forwarded untouched
 * @param meta             queued time, due date, product group/variant and similar hints
 */
public record OptimizerOrder(String id, String possibleSequence, String processTimes,
    Map<String, Object> meta) {
  public OptimizerOrder {
    Objects.requireNonNull(id, "id");
    meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
  }
}
