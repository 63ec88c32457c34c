package stagequeue.jdbc;

import java.util.Objects;

/**
 * Table naming shared by the JDBC stores. Every table is {@code prefix + suffix};
 * the reference DDL in {@code stagequeue/jdbc/schema.sql} uses {@link #DEFAULT_PREFIX}.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "sq_";

  public static final String QUEUE_ENTRY = "queue_entry";
  public static final String STAGE_CONFIG = "stage_config";
  public static final String FACTORY = "factory";
  public static final String ORDER = "order";
  public static final String DELIVERY_DATE = "delivery_date";
  public static final String DISPATCH_ORDER = "dispatch_order";
  public static final String SCHEDULING_LOG = "scheduling_log";

  private static final String PREFIX_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validatePrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.matches(PREFIX_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + prefix);
    }
    return prefix;
  }

  public static String table(String prefix, String suffix) {
    return validatePrefix(prefix) + suffix;
  }
}
