package stagequeue.hold;

/**
 * Per-order result of a multi-hold request.
 *
 * @param error why the hold was not applied, {@code null} if {@code applied}
 */
public record HoldItemResult(String orderId, boolean applied, String error) {

  public static HoldItemResult ok(String orderId) {
    return new HoldItemResult(orderId, true, null);
  }

  public static HoldItemResult failed(String orderId, String error) {
    return new HoldItemResult(orderId, false, error);
  }
}
