package stagequeue.model;

/**
 * A pending or released work item in one stage queue.
 *
 * <p>{@code releasedAtSimMinute == null} means pending. The three hold fields are
 * either all set or all {@code null}; {@code holdCount} only ever grows.
 *
 * @see stagequeue.spi.QueueStore
 */
public record QueueEntry(
    String id,
    String factoryId,
    String orderId,
    Stage stage,
    String possibleSequence,
    String processTimes,
    long processingOrder,
    long queuedAtSimMinute,
    int releaseAfterMinutes,
    Long releasedAtSimMinute,
    Long holdUntilSimMinute,
    String holdReason,
    Long holdSetAtSimMinute,
    int holdCount
) {

  public boolean isPending() {
    return releasedAtSimMinute == null;
  }

  /** Earliest sim-minute at which this entry is individually due. */
  public long releaseAtSimMinute() {
    return queuedAtSimMinute + releaseAfterMinutes;
  }

  /** Minutes left until individually due, never negative. */
  public long waitMinutes(long nowSimMinute) {
    return Math.max(0, releaseAtSimMinute() - nowSimMinute);
  }

  public boolean hasHold() {
    return holdUntilSimMinute != null;
  }

  public boolean isOnHold(long nowSimMinute) {
    return holdUntilSimMinute != null && nowSimMinute < holdUntilSimMinute;
  }

  public boolean isHoldExpired(long nowSimMinute) {
    return holdUntilSimMinute != null && nowSimMinute >= holdUntilSimMinute;
  }

  public EntryState state(long nowSimMinute) {
    if (!isPending()) {
      return EntryState.RELEASED;
    }
    if (isOnHold(nowSimMinute)) {
      return EntryState.ON_HOLD;
    }
    return isHoldExpired(nowSimMinute) ? EntryState.HOLD_EXPIRED : EntryState.PENDING;
  }
}
