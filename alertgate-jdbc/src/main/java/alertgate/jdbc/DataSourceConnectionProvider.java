package alertgate.jdbc;

import alertgate.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens connections to the alert tables from the application's {@link DataSource}.
 *
 * <p>{@link JdbcAlertQueries} and {@link JdbcCommandExecutor} take one connection per query
 * or status update and close it when done, so a pooled data source is recommended.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }
}
