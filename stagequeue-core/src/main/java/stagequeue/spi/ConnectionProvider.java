package stagequeue.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the scheduler. Every operation borrows one connection,
 * uses it for all store calls of that operation and closes it.
 *
 * <p>With a {@code javax.sql.DataSource} this is simply {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;
}
