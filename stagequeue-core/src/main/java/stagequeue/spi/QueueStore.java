package stagequeue.spi;

import stagequeue.model.QueueEntry;
import stagequeue.model.Stage;

import java.sql.Connection;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for stage queue entries.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations must enforce uniqueness of
 * {@code (stage, orderId)}: a released entry is deleted before a fresh one is
 * inserted for the same order, so the unique key also guarantees at most one
 * pending entry per order and stage.
 *
 * @see stagequeue.jdbc.store.JdbcQueueStore
 */
public interface QueueStore {

    /**
     * Finds the entry (pending or released) for an order in a stage.
     *
     * @param conn    the JDBC connection
     * @param stage   the stage queue
     * @param orderId the order business key
     * @return the entry, or empty if the order was never queued in this stage
     */
    Optional<QueueEntry> find(Connection conn, Stage stage, String orderId);

    /**
     * Inserts a new pending entry.
     *
     * @param conn  the JDBC connection
     * @param entry the entry to insert
     * @return {@code false} if an entry for the same stage and order already exists
     */
    boolean insert(Connection conn, QueueEntry entry);

    /**
     * Deletes an entry by id.
     *
     * @return the number of rows deleted (0 or 1)
     */
    int delete(Connection conn, String entryId);

    /**
     * Returns the highest {@code processingOrder} ever assigned in a stage, or {@code 0}
     * if the stage queue is empty.
     */
    long maxProcessingOrder(Connection conn, Stage stage);

    /**
     * Lists pending entries of a stage across all factories, ordered by
     * {@code (processingOrder, queuedAtSimMinute)}.
     */
    List<QueueEntry> listPending(Connection conn, Stage stage);

    /**
     * Lists pending entries of one factory's stage queue, ordered by
     * {@code (processingOrder, queuedAtSimMinute)}.
     */
    List<QueueEntry> listPending(Connection conn, String factoryId, Stage stage);

    /**
     * Sets {@code releasedAtSimMinute} for the given orders. Rows that are not
     * pending are left untouched.
     *
     * @return the number of rows released
     */
    int markReleased(Connection conn, Stage stage, Collection<String> orderIds, long simMinute);

    /**
     * Overwrites the hold fields of a pending entry and increments its {@code holdCount}.
     *
     * @return the number of rows updated (0 if the order is not pending in this stage)
     */
    int setHold(Connection conn, Stage stage, String orderId, long holdUntilSimMinute,
        String reason, long holdSetAtSimMinute);

    /**
     * Clears the hold fields of a pending entry. {@code holdCount} is kept.
     *
     * @return the number of rows updated
     */
    int clearHold(Connection conn, Stage stage, String orderId);

    /**
     * Deletes released entries of a stage.
     *
     * @return the number of rows deleted
     */
    int deleteReleased(Connection conn, Stage stage);

    /**
     * Deletes every entry of every stage.
     *
     * @return the number of rows deleted
     */
    int deleteAll(Connection conn);
}
