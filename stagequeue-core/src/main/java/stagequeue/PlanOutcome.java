package stagequeue;

import java.util.List;

/**
 * Result of a planning pass that orders a stage queue without releasing it.
 *
 * @param orderIds             pending order ids in planned dispatch order
 * @param optimized            {@code true} if an optimizer result shaped the order
 * @param holdDecisionsApplied optimizer hold decisions written to the queue
 */
public record PlanOutcome(
    List<String> orderIds,
    boolean optimized,
    int reorderCount,
    int holdDecisionsApplied,
    int etaWrites,
    int etaFailures
) {
  public PlanOutcome {
    orderIds = List.copyOf(orderIds);
  }
}
