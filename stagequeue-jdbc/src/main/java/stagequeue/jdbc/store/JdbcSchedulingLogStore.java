package stagequeue.jdbc.store;

import stagequeue.jdbc.JdbcTemplate;
import stagequeue.jdbc.TableNames;
import stagequeue.model.LogMode;
import stagequeue.model.SchedulingLogEntry;
import stagequeue.model.Stage;
import stagequeue.spi.SchedulingLogStore;
import stagequeue.util.JsonCodec;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;

/**
 * {@link SchedulingLogStore} storing {@code details} as a JSON text column.
 */
public class JdbcSchedulingLogStore extends AbstractJdbcStore implements SchedulingLogStore {

  private static final String COLUMNS = "id, factory_id, stage, mode, details, created_at";

  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<SchedulingLogEntry> rowMapper;

  public JdbcSchedulingLogStore() {
    this(TableNames.DEFAULT_PREFIX, JsonCodec.getDefault());
  }

  public JdbcSchedulingLogStore(String tablePrefix, JsonCodec jsonCodec) {
    super(tablePrefix, TableNames.SCHEDULING_LOG);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new SchedulingLogEntry(
        rs.getString("id"),
        rs.getString("factory_id"),
        Stage.fromCode(rs.getString("stage")),
        LogMode.valueOf(rs.getString("mode")),
        this.jsonCodec.parseObject(rs.getString("details")),
        JdbcTemplate.getNullableInstant(rs, "created_at"));
  }

  @Override
  public void append(Connection conn, SchedulingLogEntry entry) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?)",
        entry.id(), entry.factoryId(), entry.stage().code(), entry.mode().name(),
        jsonCodec.toJson(entry.details()), entry.timestamp());
  }

  @Override
  public List<SchedulingLogEntry> recent(Connection conn, String factoryId, Stage stage, int limit) {
    if (stage == null) {
      return JdbcTemplate.query(conn,
          "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE factory_id=?"
              + " ORDER BY created_at DESC, id DESC LIMIT ?",
          rowMapper, factoryId, limit);
    }
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE factory_id=? AND stage=?"
            + " ORDER BY created_at DESC, id DESC LIMIT ?",
        rowMapper, factoryId, stage.code(), limit);
  }

  @Override
  public int deleteByFactory(Connection conn, String factoryId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE factory_id=?", factoryId);
  }
}
