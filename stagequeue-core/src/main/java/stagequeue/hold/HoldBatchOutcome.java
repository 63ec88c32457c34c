package stagequeue.hold;

import java.util.List;

/**
 * @param applied number of holds written
 * @param items   one result per request, in request order
 */
public record HoldBatchOutcome(int applied, List<HoldItemResult> items) {
  public HoldBatchOutcome {
    items = List.copyOf(items);
  }
}
