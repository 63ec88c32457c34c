package stagequeue.release;

import stagequeue.model.QueueEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A pending pool in reconciled order plus non-authoritative diagnostics.
 *
 * @param ordered      every pending entry, ranked entries first
 * @param ranked       {@code true} if an optimizer ranking shaped the order
 * @param reorderCount positions differing from FIFO order
 * @param diffCount    mismatches against the optimizer's raw ranking, padded by the length difference
 */
public record ReconcileResult(List<QueueEntry> ordered, boolean ranked, int reorderCount,
    int diffCount) {

  public ReconcileResult {
    ordered = List.copyOf(ordered);
  }

  public List<String> orderIds() {
    return ordered.stream().map(QueueEntry::orderId).toList();
  }

  /** Order ids in reconciled order, skipping {@code excludedOrderIds}. */
  public List<String> orderIdsExcluding(Collection<String> excludedOrderIds) {
    List<String> ids = new ArrayList<>(ordered.size());
    for (QueueEntry entry : ordered) {
      if (!excludedOrderIds.contains(entry.orderId())) {
        ids.add(entry.orderId());
      }
    }
    return ids;
  }
}
