package stagequeue.jdbc.store;

import stagequeue.jdbc.JdbcTemplate;
import stagequeue.jdbc.TableNames;
import stagequeue.model.OrderInfo;
import stagequeue.spi.OrderDirectory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only {@link OrderDirectory} over the order and factory tables. Orders carry the
 * optimizer hints {@code dueDate}, {@code productGroup}, {@code productVariant} and
 * {@code createdAt}; absent values are left out of the metadata.
 */
public class JdbcOrderDirectory implements OrderDirectory {

  private final String orderTable;
  private final String factoryTable;

  public JdbcOrderDirectory() {
    this(TableNames.DEFAULT_PREFIX);
  }

  public JdbcOrderDirectory(String tablePrefix) {
    this.orderTable = TableNames.table(tablePrefix, TableNames.ORDER);
    this.factoryTable = TableNames.table(tablePrefix, TableNames.FACTORY);
  }

  private static OrderInfo map(ResultSet rs) throws SQLException {
    Map<String, Object> meta = new LinkedHashMap<>();
    Long dueDate = JdbcTemplate.getNullableLong(rs, "due_date");
    if (dueDate != null) {
      meta.put("dueDate", dueDate);
    }
    putIfPresent(meta, "productGroup", rs.getString("product_group"));
    putIfPresent(meta, "productVariant", rs.getString("product_variant"));
    Instant createdAt = JdbcTemplate.getNullableInstant(rs, "created_at");
    if (createdAt != null) {
      meta.put("createdAt", createdAt.toString());
    }
    return new OrderInfo(rs.getString("order_id"), rs.getString("factory_id"), meta);
  }

  private static void putIfPresent(Map<String, Object> meta, String key, String value) {
    if (value != null) {
      meta.put(key, value);
    }
  }

  private String select() {
    return "SELECT order_id, factory_id, due_date, product_group, product_variant, created_at"
        + " FROM " + orderTable;
  }

  @Override
  public Optional<OrderInfo> findOrder(Connection conn, String orderId) {
    return JdbcTemplate.queryOne(conn, select() + " WHERE order_id=?",
        JdbcOrderDirectory::map, orderId);
  }

  @Override
  public Map<String, OrderInfo> findOrders(Connection conn, Collection<String> orderIds) {
    Map<String, OrderInfo> result = new LinkedHashMap<>();
    if (orderIds.isEmpty()) {
      return result;
    }
    Collection<String> ids = new LinkedHashSet<>(orderIds);
    for (OrderInfo info : JdbcTemplate.query(conn,
        select() + " WHERE order_id IN " + JdbcTemplate.placeholders(ids),
        JdbcOrderDirectory::map, ids.toArray())) {
      result.put(info.orderId(), info);
    }
    return result;
  }

  @Override
  public boolean factoryExists(Connection conn, String factoryId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT factory_id FROM " + factoryTable + " WHERE factory_id=?",
        rs -> rs.getString("factory_id"), factoryId).isPresent();
  }
}
