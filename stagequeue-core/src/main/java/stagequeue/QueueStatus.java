package stagequeue;

import stagequeue.model.EntryState;
import stagequeue.model.QueueEntry;
import stagequeue.model.Stage;

import java.util.List;

/**
 * Snapshot of a stage queue at a given sim-minute.
 */
public record QueueStatus(Stage stage, long atSimMinute, int totalCount, int readyCount,
    int onHoldCount, List<EntryStatus> entries) {

  public QueueStatus {
    entries = List.copyOf(entries);
  }

  /**
   * @param ready       {@code true} if individually due and not on hold
   * @param waitMinutes {@code max(0, queuedAt + releaseAfter - now)}
   */
  public record EntryStatus(QueueEntry entry, EntryState state, boolean ready, long waitMinutes,
      long releaseAtSimMinute) {}
}
