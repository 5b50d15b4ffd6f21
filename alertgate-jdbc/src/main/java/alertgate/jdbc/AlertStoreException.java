package alertgate.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcAlertQueries} and
 * {@link JdbcCommandExecutor}.
 */
public final class AlertStoreException extends RuntimeException {
  public AlertStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
