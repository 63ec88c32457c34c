package stagequeue.jdbc.store;

import stagequeue.jdbc.JdbcTemplate;
import stagequeue.jdbc.QueueStoreException;
import stagequeue.jdbc.TableNames;
import stagequeue.model.Stage;
import stagequeue.model.StageConfig;
import stagequeue.spi.StageConfigRepository;

import java.sql.Connection;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link StageConfigRepository} keyed by {@code (factory_id, stage)}.
 *
 * <p>The window marker is only ever set by a conditional update on a closed window, so
 * two writers racing to open the same window cannot both succeed.
 */
public class JdbcStageConfigRepository extends AbstractJdbcStore implements StageConfigRepository {

  private static final String COLUMNS = "factory_id, stage, release_after_minutes, "
      + "batch_start_sim_minute, optimizer_script, updated_at";

  private static final JdbcTemplate.RowMapper<StageConfig> ROW_MAPPER = rs -> new StageConfig(
      rs.getString("factory_id"),
      Stage.fromCode(rs.getString("stage")),
      rs.getInt("release_after_minutes"),
      JdbcTemplate.getNullableLong(rs, "batch_start_sim_minute"),
      rs.getString("optimizer_script"),
      JdbcTemplate.getNullableInstant(rs, "updated_at"));

  private final Clock clock;

  public JdbcStageConfigRepository() {
    this(TableNames.DEFAULT_PREFIX, Clock.systemUTC());
  }

  public JdbcStageConfigRepository(String tablePrefix, Clock clock) {
    super(tablePrefix, TableNames.STAGE_CONFIG);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<StageConfig> find(Connection conn, String factoryId, Stage stage) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE factory_id=? AND stage=?",
        ROW_MAPPER, factoryId, stage.code());
  }

  @Override
  public List<StageConfig> findByFactory(Connection conn, String factoryId) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE factory_id=? ORDER BY stage",
        ROW_MAPPER, factoryId);
  }

  @Override
  public void saveSettings(Connection conn, String factoryId, Stage stage, int releaseAfterMinutes,
      String optimizerScript) {
    if (updateSettings(conn, factoryId, stage, releaseAfterMinutes, optimizerScript) > 0) {
      return;
    }
    try {
      JdbcTemplate.update(conn,
          "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,NULL,?,?)",
          factoryId, stage.code(), releaseAfterMinutes, optimizerScript, clock.instant());
    } catch (QueueStoreException e) {
      if (!JdbcTemplate.isDuplicateKey(e)) {
        throw e;
      }
      // created concurrently; apply the settings on top
      updateSettings(conn, factoryId, stage, releaseAfterMinutes, optimizerScript);
    }
  }

  private int updateSettings(Connection conn, String factoryId, Stage stage,
      int releaseAfterMinutes, String optimizerScript) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET release_after_minutes=?, optimizer_script=?, updated_at=?"
            + " WHERE factory_id=? AND stage=?",
        releaseAfterMinutes, optimizerScript, clock.instant(), factoryId, stage.code());
  }

  @Override
  public boolean openWindow(Connection conn, String factoryId, Stage stage, long simMinute) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET batch_start_sim_minute=?, updated_at=?"
            + " WHERE factory_id=? AND stage=? AND batch_start_sim_minute IS NULL",
        simMinute, clock.instant(), factoryId, stage.code()) > 0;
  }

  @Override
  public int closeWindow(Connection conn, String factoryId, Stage stage) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET batch_start_sim_minute=NULL, updated_at=?"
            + " WHERE factory_id=? AND stage=? AND batch_start_sim_minute IS NOT NULL",
        clock.instant(), factoryId, stage.code());
  }

  @Override
  public int closeAllWindows(Connection conn) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET batch_start_sim_minute=NULL, updated_at=?"
            + " WHERE batch_start_sim_minute IS NOT NULL",
        clock.instant());
  }
}
