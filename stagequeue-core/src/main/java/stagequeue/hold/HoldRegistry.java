package stagequeue.hold;

import stagequeue.model.QueueEntry;
import stagequeue.model.Stage;
import stagequeue.optimizer.OptimizerResult.HoldDecision;
import stagequeue.spi.QueueStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Temporary, reason-annotated suppression of release eligibility per queue entry.
 *
 * <p>Holds live on the {@link QueueEntry} rows themselves; this class owns the rules:
 * setting a hold overwrites the previous one and bumps {@code holdCount}, clearing keeps
 * the count, and a hold whose {@code holdUntilSimMinute} has been reached is cleared
 * automatically the next time the entry is scanned for release.
 */
public final class HoldRegistry {
  private static final Logger logger = Logger.getLogger(HoldRegistry.class.getName());

  private final QueueStore queueStore;

  public HoldRegistry(QueueStore queueStore) {
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
  }

  /**
   * Holds a pending entry until {@code holdUntilSimMinute}.
   *
   * @return {@code true} if the entry was pending and the hold was written
   */
  public boolean setHold(Connection conn, Stage stage, String orderId, long holdUntilSimMinute,
      String reason, long nowSimMinute) {
    return queueStore.setHold(conn, stage, orderId, holdUntilSimMinute, reason, nowSimMinute) > 0;
  }

  /**
   * @return {@code true} if a pending entry was found and its hold fields cleared
   */
  public boolean clearHold(Connection conn, Stage stage, String orderId) {
    return queueStore.clearHold(conn, stage, orderId) > 0;
  }

  /**
   * Applies each request independently. A failing request is reported in its item result
   * and does not stop the remaining ones.
   */
  public HoldBatchOutcome setMultiple(Connection conn, Stage stage, List<HoldRequest> requests,
      long nowSimMinute) {
    List<HoldItemResult> items = new ArrayList<>(requests.size());
    int applied = 0;
    for (HoldRequest request : requests) {
      if (request.reason() == null || request.reason().isBlank()) {
        items.add(HoldItemResult.failed(request.orderId(), "reason is required"));
        continue;
      }
      try {
        if (setHold(conn, stage, request.orderId(), request.holdUntilSimMinute(), request.reason(),
            nowSimMinute)) {
          items.add(HoldItemResult.ok(request.orderId()));
          applied++;
        } else {
          items.add(HoldItemResult.failed(request.orderId(), "order not pending in " + stage.code()));
        }
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to set hold for order " + request.orderId()
            + " in " + stage.code(), e);
        items.add(HoldItemResult.failed(request.orderId(), e.getMessage()));
      }
    }
    return new HoldBatchOutcome(applied, items);
  }

  /**
   * Clears expired holds among {@code pending} in the store. Cleared entries keep their
   * position; entries still on hold stay in the list and are reported by
   * {@link HoldPartition#heldOrderIds(long)}.
   */
  public HoldPartition partition(Connection conn, Stage stage, List<QueueEntry> pending,
      long nowSimMinute) {
    List<QueueEntry> entries = new ArrayList<>(pending.size());
    int cleared = 0;
    for (QueueEntry entry : pending) {
      if (entry.isHoldExpired(nowSimMinute)) {
        queueStore.clearHold(conn, stage, entry.orderId());
        cleared++;
        entries.add(withoutHold(entry));
      } else {
        entries.add(entry);
      }
    }
    if (cleared > 0) {
      logger.fine(() -> "Auto-cleared expired holds in " + stage.code() + " at " + nowSimMinute);
    }
    return new HoldPartition(entries, cleared);
  }

  /**
   * Applies optimizer hold decisions. A decision is accepted only if its order is among
   * {@code pendingOrderIds}, its {@code holdUntilSimMinute} lies after {@code nowSimMinute},
   * and it carries a non-blank reason; others are ignored.
   *
   * @return the order ids that were put on hold
   */
  public List<String> applyDecisions(Connection conn, Stage stage, Collection<HoldDecision> decisions,
      Set<String> pendingOrderIds, long nowSimMinute) {
    List<String> applied = new ArrayList<>();
    if (decisions == null) {
      return applied;
    }
    for (HoldDecision decision : decisions) {
      if (decision.orderId() == null || !pendingOrderIds.contains(decision.orderId())
          || decision.holdUntilSimMinute() == null || decision.holdUntilSimMinute() <= nowSimMinute
          || decision.reason() == null || decision.reason().isBlank()) {
        continue;
      }
      if (setHold(conn, stage, decision.orderId(), decision.holdUntilSimMinute(), decision.reason(),
          nowSimMinute)) {
        applied.add(decision.orderId());
      }
    }
    return applied;
  }

  static QueueEntry withoutHold(QueueEntry entry) {
    return new QueueEntry(entry.id(), entry.factoryId(), entry.orderId(), entry.stage(),
        entry.possibleSequence(), entry.processTimes(), entry.processingOrder(),
        entry.queuedAtSimMinute(), entry.releaseAfterMinutes(), entry.releasedAtSimMinute(),
        null, null, null, entry.holdCount());
  }
}
