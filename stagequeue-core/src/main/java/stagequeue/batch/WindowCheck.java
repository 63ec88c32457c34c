package stagequeue.batch;

/**
 * Whether a stage is due to release.
 *
 * @param waitMinutes minutes until the open window matures, 0 when due or no window is open
 */
public record WindowCheck(boolean due, boolean windowOpen, long waitMinutes, String message) {

  static WindowCheck immediate() {
    return new WindowCheck(true, false, 0, "Immediate release");
  }

  static WindowCheck matured() {
    return new WindowCheck(true, true, 0, "Batch window matured");
  }

  static WindowCheck noActiveBatch() {
    return new WindowCheck(false, false, 0, "No active batch");
  }

  static WindowCheck waiting(long waitMinutes) {
    return new WindowCheck(false, true, waitMinutes, "Waiting " + waitMinutes + " more minutes");
  }
}
