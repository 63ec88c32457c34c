package stagequeue;

import stagequeue.model.QueueEntry;

/**
 * Result of a single-item release.
 *
 * @param released    {@code true} if {@code entry} was released by this call
 * @param waiting     {@code true} if the head entry exists but is not yet due
 * @param waitMinutes minutes until the head entry is due (0 unless {@code waiting})
 * @param entry       the released or waiting entry, {@code null} if the queue has none eligible
 */
public record ReleaseOutcome(
    boolean released,
    boolean waiting,
    long waitMinutes,
    QueueEntry entry,
    String message
) {

  static ReleaseOutcome released(QueueEntry entry) {
    return new ReleaseOutcome(true, false, 0, entry, "Released order " + entry.orderId());
  }

  static ReleaseOutcome waiting(QueueEntry entry, long waitMinutes) {
    return new ReleaseOutcome(false, true, waitMinutes, entry,
        "Waiting " + waitMinutes + " more minutes");
  }

  static ReleaseOutcome nothing(String message) {
    return new ReleaseOutcome(false, false, 0, null, message);
  }
}
