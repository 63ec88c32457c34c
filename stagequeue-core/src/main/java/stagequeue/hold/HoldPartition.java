package stagequeue.hold;

import stagequeue.model.QueueEntry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pending entries of one release cycle after expired holds were cleared.
 *
 * @param pending      entries in input order; expired holds already removed
 * @param clearedCount expired holds auto-cleared while partitioning
 */
public record HoldPartition(List<QueueEntry> pending, int clearedCount) {
  public HoldPartition {
    pending = List.copyOf(pending);
  }

  /** Order ids whose hold lies after {@code nowSimMinute}, in input order. */
  public Set<String> heldOrderIds(long nowSimMinute) {
    Set<String> held = new LinkedHashSet<>();
    for (QueueEntry entry : pending) {
      if (entry.isOnHold(nowSimMinute)) {
        held.add(entry.orderId());
      }
    }
    return held;
  }

  /** Same cleared count over a fresh read of the queue. */
  public HoldPartition withPending(List<QueueEntry> refreshed) {
    return new HoldPartition(refreshed, clearedCount);
  }
}
