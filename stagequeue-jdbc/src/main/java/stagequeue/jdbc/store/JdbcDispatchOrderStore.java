package stagequeue.jdbc.store;

import stagequeue.jdbc.JdbcTemplate;
import stagequeue.jdbc.TableNames;
import stagequeue.model.Stage;
import stagequeue.spi.DispatchOrderStore;

import java.sql.Connection;
import java.util.List;
import java.util.OptionalInt;

/**
 * {@link DispatchOrderStore} holding one sequence number per {@code (stage, order_id)}.
 * Each write upserts row by row; orders not named keep their previous number.
 */
public class JdbcDispatchOrderStore extends AbstractJdbcStore implements DispatchOrderStore {
  private final String orderTable;

  public JdbcDispatchOrderStore() {
    this(TableNames.DEFAULT_PREFIX);
  }

  public JdbcDispatchOrderStore(String tablePrefix) {
    super(tablePrefix, TableNames.DISPATCH_ORDER);
    this.orderTable = TableNames.table(tablePrefix, TableNames.ORDER);
  }

  @Override
  public void write(Connection conn, Stage stage, List<String> orderIds) {
    String update = "UPDATE " + tableName() + " SET sequence_no=? WHERE stage=? AND order_id=?";
    String insert = "INSERT INTO " + tableName() + " (stage, order_id, sequence_no) VALUES (?,?,?)";
    for (int i = 0; i < orderIds.size(); i++) {
      int sequence = i + 1;
      String orderId = orderIds.get(i);
      if (JdbcTemplate.update(conn, update, sequence, stage.code(), orderId) == 0) {
        JdbcTemplate.update(conn, insert, stage.code(), orderId, sequence);
      }
    }
  }

  @Override
  public OptionalInt find(Connection conn, Stage stage, String orderId) {
    return JdbcTemplate.queryOne(conn,
            "SELECT sequence_no FROM " + tableName() + " WHERE stage=? AND order_id=?",
            rs -> rs.getInt("sequence_no"), stage.code(), orderId)
        .map(OptionalInt::of)
        .orElse(OptionalInt.empty());
  }

  @Override
  public int clearFactory(Connection conn, Stage stage, String factoryId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE stage=? AND order_id IN"
        + " (SELECT order_id FROM " + orderTable + " WHERE factory_id=?)", stage.code(), factoryId);
  }
}
