package stagequeue.spi;

import stagequeue.model.SchedulingLogEntry;
import stagequeue.model.Stage;

import java.sql.Connection;
import java.util.List;

/**
 * Append-only storage for scheduling log entries.
 *
 * @see stagequeue.log.SchedulingLog
 */
public interface SchedulingLogStore {

    void append(Connection conn, SchedulingLogEntry entry);

    /**
     * Returns the most recent entries of a factory, newest first.
     *
     * @param stage restricts to one stage, or {@code null} for all stages
     * @param limit maximum number of entries
     */
    List<SchedulingLogEntry> recent(Connection conn, String factoryId, Stage stage, int limit);

    /** @return the number of entries deleted */
    int deleteByFactory(Connection conn, String factoryId);
}
