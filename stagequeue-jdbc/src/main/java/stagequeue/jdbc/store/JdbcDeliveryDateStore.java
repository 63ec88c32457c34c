package stagequeue.jdbc.store;

import stagequeue.jdbc.JdbcTemplate;
import stagequeue.jdbc.QueueStoreException;
import stagequeue.jdbc.TableNames;
import stagequeue.model.DeliveryDateRecord;
import stagequeue.model.Stage;
import stagequeue.spi.DeliveryDateStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * {@link DeliveryDateStore} keeping every estimate as history with an {@code is_current}
 * flag. Superseding the current record and inserting the new one commit together: on an
 * auto-commit connection both statements run in a local transaction, otherwise in the
 * caller's.
 */
public class JdbcDeliveryDateStore extends AbstractJdbcStore implements DeliveryDateStore {

  private static final String COLUMNS =
      "id, order_id, stage, eta_sim_minute, calendar_at, optimizer, is_current, created_at";

  private static final JdbcTemplate.RowMapper<DeliveryDateRecord> ROW_MAPPER =
      rs -> new DeliveryDateRecord(
          rs.getString("id"),
          rs.getString("order_id"),
          Stage.fromCode(rs.getString("stage")),
          rs.getLong("eta_sim_minute"),
          JdbcTemplate.getNullableInstant(rs, "calendar_at"),
          rs.getString("optimizer"),
          rs.getBoolean("is_current"),
          JdbcTemplate.getNullableInstant(rs, "created_at"));

  public JdbcDeliveryDateStore() {
    this(TableNames.DEFAULT_PREFIX);
  }

  public JdbcDeliveryDateStore(String tablePrefix) {
    super(tablePrefix, TableNames.DELIVERY_DATE);
  }

  @Override
  public int supersedeAndInsert(Connection conn, DeliveryDateRecord record) {
    boolean localTx;
    try {
      localTx = conn.getAutoCommit();
      if (localTx) {
        conn.setAutoCommit(false);
      }
    } catch (SQLException e) {
      throw new QueueStoreException("Failed to begin delivery date transaction", e);
    }
    try {
      int superseded = JdbcTemplate.update(conn,
          "UPDATE " + tableName() + " SET is_current=? WHERE order_id=? AND is_current=?",
          false, record.orderId(), true);
      JdbcTemplate.update(conn,
          "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
          record.id(), record.orderId(), record.stage().code(), record.etaSimMinute(),
          record.calendarAt(), record.optimizer(), true, record.createdAt());
      if (localTx) {
        conn.commit();
      }
      return superseded;
    } catch (SQLException | RuntimeException e) {
      if (localTx) {
        rollbackQuietly(conn, e);
      }
      if (e instanceof QueueStoreException qse) {
        throw qse;
      }
      throw new QueueStoreException("Failed to write delivery date for " + record.orderId(), e);
    } finally {
      if (localTx) {
        try {
          conn.setAutoCommit(true);
        } catch (SQLException e) {
          throw new QueueStoreException("Failed to restore auto-commit", e);
        }
      }
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  @Override
  public Optional<DeliveryDateRecord> findCurrent(Connection conn, String orderId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE order_id=? AND is_current=?",
        ROW_MAPPER, orderId, true);
  }

  @Override
  public List<DeliveryDateRecord> history(Connection conn, String orderId) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE order_id=?"
            + " ORDER BY created_at DESC, id DESC",
        ROW_MAPPER, orderId);
  }
}
