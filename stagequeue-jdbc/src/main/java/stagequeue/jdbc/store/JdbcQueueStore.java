package stagequeue.jdbc.store;

import stagequeue.jdbc.JdbcTemplate;
import stagequeue.jdbc.QueueStoreException;
import stagequeue.jdbc.TableNames;
import stagequeue.model.QueueEntry;
import stagequeue.model.Stage;
import stagequeue.spi.QueueStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * {@link QueueStore} on a single table with a unique key on {@code (stage, order_id)}.
 * A concurrent duplicate insert is detected through that key and reported as
 * {@code false} rather than an error.
 */
public class JdbcQueueStore extends AbstractJdbcStore implements QueueStore {

  private static final String COLUMNS = "id, factory_id, order_id, stage, possible_sequence, "
      + "process_times, processing_order, queued_at_sim_minute, release_after_minutes, "
      + "released_at_sim_minute, hold_until_sim_minute, hold_reason, hold_set_at_sim_minute, "
      + "hold_count";

  private static final JdbcTemplate.RowMapper<QueueEntry> ROW_MAPPER = rs -> new QueueEntry(
      rs.getString("id"),
      rs.getString("factory_id"),
      rs.getString("order_id"),
      Stage.fromCode(rs.getString("stage")),
      rs.getString("possible_sequence"),
      rs.getString("process_times"),
      rs.getLong("processing_order"),
      rs.getLong("queued_at_sim_minute"),
      rs.getInt("release_after_minutes"),
      JdbcTemplate.getNullableLong(rs, "released_at_sim_minute"),
      JdbcTemplate.getNullableLong(rs, "hold_until_sim_minute"),
      rs.getString("hold_reason"),
      JdbcTemplate.getNullableLong(rs, "hold_set_at_sim_minute"),
      rs.getInt("hold_count"));

  private static final String PENDING_ORDER = " ORDER BY processing_order, queued_at_sim_minute";

  public JdbcQueueStore() {
    this(TableNames.DEFAULT_PREFIX);
  }

  public JdbcQueueStore(String tablePrefix) {
    super(tablePrefix, TableNames.QUEUE_ENTRY);
  }

  @Override
  public Optional<QueueEntry> find(Connection conn, Stage stage, String orderId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE stage=? AND order_id=?",
        ROW_MAPPER, stage.code(), orderId);
  }

  @Override
  public boolean insert(Connection conn, QueueEntry entry) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, sql,
          entry.id(), entry.factoryId(), entry.orderId(), entry.stage().code(),
          entry.possibleSequence(), entry.processTimes(), entry.processingOrder(),
          entry.queuedAtSimMinute(), entry.releaseAfterMinutes(), entry.releasedAtSimMinute(),
          entry.holdUntilSimMinute(), entry.holdReason(), entry.holdSetAtSimMinute(),
          entry.holdCount());
      return true;
    } catch (QueueStoreException e) {
      if (JdbcTemplate.isDuplicateKey(e)) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public int delete(Connection conn, String entryId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE id=?", entryId);
  }

  @Override
  public long maxProcessingOrder(Connection conn, Stage stage) {
    return JdbcTemplate.queryOne(conn,
        "SELECT COALESCE(MAX(processing_order), 0) AS max_order FROM " + tableName()
            + " WHERE stage=?",
        rs -> rs.getLong("max_order"), stage.code()).orElse(0L);
  }

  @Override
  public List<QueueEntry> listPending(Connection conn, Stage stage) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName()
            + " WHERE stage=? AND released_at_sim_minute IS NULL" + PENDING_ORDER,
        ROW_MAPPER, stage.code());
  }

  @Override
  public List<QueueEntry> listPending(Connection conn, String factoryId, Stage stage) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName()
            + " WHERE factory_id=? AND stage=? AND released_at_sim_minute IS NULL" + PENDING_ORDER,
        ROW_MAPPER, factoryId, stage.code());
  }

  @Override
  public int markReleased(Connection conn, Stage stage, Collection<String> orderIds, long simMinute) {
    if (orderIds.isEmpty()) {
      return 0;
    }
    Collection<String> ids = new LinkedHashSet<>(orderIds);
    List<Object> params = new ArrayList<>(ids.size() + 2);
    params.add(simMinute);
    params.add(stage.code());
    params.addAll(ids);
    String sql = "UPDATE " + tableName() + " SET released_at_sim_minute=?"
        + " WHERE stage=? AND released_at_sim_minute IS NULL AND order_id IN "
        + JdbcTemplate.placeholders(ids);
    return JdbcTemplate.update(conn, sql, params.toArray());
  }

  @Override
  public int setHold(Connection conn, Stage stage, String orderId, long holdUntilSimMinute,
      String reason, long holdSetAtSimMinute) {
    String sql = "UPDATE " + tableName()
        + " SET hold_until_sim_minute=?, hold_reason=?, hold_set_at_sim_minute=?,"
        + " hold_count=hold_count+1"
        + " WHERE stage=? AND order_id=? AND released_at_sim_minute IS NULL";
    return JdbcTemplate.update(conn, sql, holdUntilSimMinute, reason, holdSetAtSimMinute,
        stage.code(), orderId);
  }

  @Override
  public int clearHold(Connection conn, Stage stage, String orderId) {
    String sql = "UPDATE " + tableName()
        + " SET hold_until_sim_minute=NULL, hold_reason=NULL, hold_set_at_sim_minute=NULL"
        + " WHERE stage=? AND order_id=? AND released_at_sim_minute IS NULL";
    return JdbcTemplate.update(conn, sql, stage.code(), orderId);
  }

  @Override
  public int deleteReleased(Connection conn, Stage stage) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tableName() + " WHERE stage=? AND released_at_sim_minute IS NOT NULL",
        stage.code());
  }

  @Override
  public int deleteAll(Connection conn) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName());
  }
}
