package stagequeue.jdbc.store;

import stagequeue.jdbc.TableNames;

/**
 * Base of the JDBC stores: resolves the store's table from a validated prefix.
 */
abstract class AbstractJdbcStore {
  private final String tableName;

  protected AbstractJdbcStore(String tablePrefix, String tableSuffix) {
    this.tableName = TableNames.table(tablePrefix, tableSuffix);
  }

  protected String tableName() {
    return tableName;
  }
}
