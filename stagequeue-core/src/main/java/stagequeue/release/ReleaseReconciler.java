package stagequeue.release;

import stagequeue.batch.BatchWindowController;
import stagequeue.model.QueueEntry;
import stagequeue.model.Stage;
import stagequeue.optimizer.OptimizerResult;
import stagequeue.spi.DispatchOrderStore;
import stagequeue.spi.QueueStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Merges optimizer output with the authoritative pending pool and commits releases.
 *
 * <p>Ranked ids come first in ranking order; local entries the optimizer did not rank
 * follow in FIFO order; ranked ids with no local entry are ignored.
 */
public final class ReleaseReconciler {
  private static final Logger logger = Logger.getLogger(ReleaseReconciler.class.getName());

  private final QueueStore queueStore;
  private final DispatchOrderStore dispatchOrderStore;
  private final BatchWindowController windowController;

  public ReleaseReconciler(QueueStore queueStore, DispatchOrderStore dispatchOrderStore,
      BatchWindowController windowController) {
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.dispatchOrderStore = Objects.requireNonNull(dispatchOrderStore, "dispatchOrderStore");
    this.windowController = Objects.requireNonNull(windowController, "windowController");
  }

  /**
   * Orders {@code pendingFifo} by the optimizer's ranking.
   *
   * @param pendingFifo pending entries in FIFO order
   * @param result      optimizer result, or {@code null} for FIFO
   */
  public ReconcileResult reconcile(List<QueueEntry> pendingFifo, OptimizerResult result) {
    List<String> ranking = result == null ? List.of() : result.ranking();
    if (ranking.isEmpty()) {
      return new ReconcileResult(pendingFifo, false, 0, 0);
    }
    Map<String, QueueEntry> byOrder = new HashMap<>();
    for (QueueEntry entry : pendingFifo) {
      byOrder.put(entry.orderId(), entry);
    }

    List<QueueEntry> ordered = new ArrayList<>(pendingFifo.size());
    Set<String> seen = new HashSet<>();
    for (String id : ranking) {
      QueueEntry entry = byOrder.get(id);
      if (seen.add(id) && entry != null) {
        ordered.add(entry);
      }
    }
    for (QueueEntry entry : pendingFifo) {
      if (!seen.contains(entry.orderId())) {
        ordered.add(entry);
      }
    }

    int reorderCount = 0;
    for (int i = 0; i < ordered.size(); i++) {
      if (!ordered.get(i).orderId().equals(pendingFifo.get(i).orderId())) {
        reorderCount++;
      }
    }
    return new ReconcileResult(ordered, true, reorderCount, diffCount(ordered, ranking));
  }

  static int diffCount(List<QueueEntry> ordered, List<String> ranking) {
    int common = Math.min(ordered.size(), ranking.size());
    int diff = Math.abs(ordered.size() - ranking.size());
    for (int i = 0; i < common; i++) {
      if (!ordered.get(i).orderId().equals(ranking.get(i))) {
        diff++;
      }
    }
    return diff;
  }

  /**
   * Marks {@code releaseOrderIds} released, rewrites dispatch sequence numbers for
   * {@code dispatchOrderIds}, and closes the batch window. If {@code reopenWindow} is set the
   * window is reopened at {@code nowSimMinute} for entries that stay behind.
   *
   * <p>Runs on the caller's connection; the caller owns the transaction.
   *
   * @return the number of entries actually released
   */
  public int commit(Connection conn, String factoryId, Stage stage, List<String> releaseOrderIds,
      List<String> dispatchOrderIds, long nowSimMinute, boolean reopenWindow) {
    int released = queueStore.markReleased(conn, stage, releaseOrderIds, nowSimMinute);
    if (released != releaseOrderIds.size()) {
      logger.fine(() -> "Released " + released + " of " + releaseOrderIds.size() + " selected "
          + stage.code() + " entries; the rest were no longer pending");
    }
    if (!dispatchOrderIds.isEmpty()) {
      dispatchOrderStore.write(conn, stage, dispatchOrderIds);
    }
    windowController.close(conn, factoryId, stage);
    if (reopenWindow) {
      windowController.openIfClosed(conn,
          windowController.getOrCreate(conn, factoryId, stage), nowSimMinute);
    }
    return released;
  }
}
