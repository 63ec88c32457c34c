package stagequeue;

import java.util.List;

/**
 * Result of a batched release check.
 *
 * @param batchReleased    {@code true} if at least one entry was released
 * @param waiting          {@code true} if a window is open but not yet mature
 * @param waitMinutes      minutes until the window matures (0 unless {@code waiting})
 * @param orderIds         released order ids in reconciled order
 * @param holdCount        pending entries excluded because they are on hold
 * @param clearedHoldCount expired holds auto-cleared during this cycle
 * @param optimized        {@code true} if an optimizer result shaped the release order
 * @param reorderCount     positions where the release order differs from FIFO
 * @param diffCount        mismatches between the release order and the optimizer's raw list
 * @param etaWrites        delivery-date records written
 * @param etaFailures      delivery-date writes that failed
 */
public record BatchReleaseOutcome(
    boolean batchReleased,
    boolean waiting,
    long waitMinutes,
    List<String> orderIds,
    int holdCount,
    int clearedHoldCount,
    boolean optimized,
    int reorderCount,
    int diffCount,
    int etaWrites,
    int etaFailures,
    String message
) {
  public BatchReleaseOutcome {
    orderIds = orderIds == null ? List.of() : List.copyOf(orderIds);
  }

  static BatchReleaseOutcome waiting(long waitMinutes) {
    return new BatchReleaseOutcome(false, true, waitMinutes, List.of(), 0, 0, false, 0, 0, 0, 0,
        "Waiting " + waitMinutes + " more minutes");
  }

  static BatchReleaseOutcome notReleased(int holdCount, int clearedHoldCount, String message) {
    return new BatchReleaseOutcome(false, false, 0, List.of(), holdCount, clearedHoldCount, false,
        0, 0, 0, 0, message);
  }
}
