package stagequeue.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Fresh in-memory H2 databases initialized with the reference schema.
 */
public final class H2Schema {

  private H2Schema() {}

  public static JdbcDataSource newDataSource() throws SQLException {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String statement : loadSchema().split(";")) {
        if (!statement.isBlank()) {
          st.execute(statement);
        }
      }
    }
    return dataSource;
  }

  public static void insertFactory(Connection conn, String factoryId) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.executeUpdate("INSERT INTO sq_factory (factory_id, name) VALUES ('" + factoryId
          + "', 'Factory " + factoryId + "')");
    }
  }

  public static void insertOrder(Connection conn, String orderId, String factoryId, long dueDate)
      throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.executeUpdate("INSERT INTO sq_order (order_id, factory_id, due_date, product_group,"
          + " product_variant, created_at) VALUES ('" + orderId + "', '" + factoryId + "', "
          + dueDate + ", 'G1', 'V1', TIMESTAMP '2026-01-05 08:00:00')");
    }
  }

  private static String loadSchema() {
    try (InputStream in = H2Schema.class.getClassLoader()
        .getResourceAsStream("stagequeue/jdbc/schema.sql")) {
      if (in == null) {
        throw new IllegalStateException("schema.sql not found on classpath");
      }
      StringBuilder sql = new StringBuilder();
      for (String line : new String(in.readAllBytes(), StandardCharsets.UTF_8).split("\n")) {
        if (!line.trim().startsWith("--")) {
          sql.append(line).append('\n');
        }
      }
      return sql.toString();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read schema.sql", e);
    }
  }
}
