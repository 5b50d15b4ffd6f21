/**
 * JDBC adapters for the alert tables.
 *
 * <p>{@link alertgate.jdbc.JdbcAlertQueries} reads send history and pending alerts;
 * {@link alertgate.jdbc.JdbcCommandExecutor} applies the status updates in-process, as an
 * alternative to {@link alertgate.command.RunOperationCommandExecutor}.
 *
 * @see alertgate.jdbc.TableNames
 * @see alertgate.jdbc.DataSourceConnectionProvider
 */
package alertgate.jdbc;
