package stagequeue.hold;

import java.util.Objects;

/**
 * A request to hold one pending order until a sim-minute.
 */
public record HoldRequest(String orderId, long holdUntilSimMinute, String reason) {
  public HoldRequest {
    Objects.requireNonNull(orderId, "orderId");
  }
}
