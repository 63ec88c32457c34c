package stagequeue;

import stagequeue.model.QueueEntry;

/**
 * @param entry   the inserted entry, or the existing pending entry when {@code skipped}
 * @param skipped {@code true} if the order was already pending in the stage
 */
public record EnqueueOutcome(QueueEntry entry, boolean skipped) {}
