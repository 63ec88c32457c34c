package stagequeue.log;

import com.github.f4b6a3.ulid.UlidCreator;
import stagequeue.SimClock;
import stagequeue.model.LogMode;
import stagequeue.model.SchedulingLogEntry;
import stagequeue.model.Stage;
import stagequeue.spi.ConnectionProvider;
import stagequeue.spi.SchedulingLogStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only record of optimizer runs and release summaries, read by dashboards.
 *
 * <p>Manages its own connections. {@link #append} never fails its caller: store
 * errors are logged at WARNING and dropped.
 */
public final class SchedulingLog {
  private static final Logger logger = Logger.getLogger(SchedulingLog.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SchedulingLogStore store;
  private final SimClock clock;

  public SchedulingLog(ConnectionProvider connectionProvider, SchedulingLogStore store, SimClock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Appends an entry.
   *
   * @return {@code true} if the entry was stored
   */
  public boolean append(String factoryId, Stage stage, LogMode mode, Map<String, Object> details) {
    SchedulingLogEntry entry = new SchedulingLogEntry(
        UlidCreator.getMonotonicUlid().toString(),
        factoryId,
        stage,
        mode,
        details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details)),
        clock.wallClockNow());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      store.append(conn, entry);
      return true;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to append " + mode + " log entry for factory " + factoryId
          + " stage " + stage.code(), e);
      return false;
    }
  }

  /**
   * Returns the newest entries of a factory, newest first.
   *
   * @param stage one stage, or {@code null} for all
   * @return the entries, or an empty list if the store could not be read
   */
  public List<SchedulingLogEntry> recent(String factoryId, Stage stage, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.recent(conn, factoryId, stage, limit);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to read scheduling log for factory " + factoryId, e);
      return List.of();
    }
  }

  /**
   * Deletes all entries of a factory.
   *
   * @return entries deleted, or {@code -1} if the store failed
   */
  public int clear(String factoryId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.deleteByFactory(conn, factoryId);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to clear scheduling log for factory " + factoryId, e);
      return -1;
    }
  }
}
