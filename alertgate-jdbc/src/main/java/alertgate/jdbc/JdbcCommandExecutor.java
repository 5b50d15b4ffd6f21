package alertgate.jdbc;

import alertgate.AlertsApi;
import alertgate.model.AlertStatus;
import alertgate.spi.CommandExecutor;
import alertgate.spi.CommandResult;
import alertgate.spi.ConnectionProvider;
import alertgate.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * In-process {@link CommandExecutor} that applies {@value AlertsApi#UPDATE_SENT_ALERTS} and
 * {@value AlertsApi#UPDATE_SKIPPED_ALERTS} directly to the alert tables.
 *
 * <p>The payload must carry {@code alert_ids} (a JSON array of strings) and
 * {@code table_name}. Only {@code pending} rows change status. Unknown operations and malformed
 * payloads are reported as failed results; JDBC errors raise {@link AlertStoreException}.
 */
public final class JdbcCommandExecutor implements CommandExecutor {
  private static final Logger logger = Logger.getLogger(JdbcCommandExecutor.class.getName());

  static final String ALERT_IDS_ARG = "alert_ids";

  private final ConnectionProvider connectionProvider;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public JdbcCommandExecutor(ConnectionProvider connectionProvider) {
    this(connectionProvider, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JdbcCommandExecutor(ConnectionProvider connectionProvider, JsonCodec jsonCodec, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public CommandResult execute(String operationName, String payloadJson) {
    AlertStatus newStatus;
    if (AlertsApi.UPDATE_SENT_ALERTS.equals(operationName)) {
      newStatus = AlertStatus.SENT;
    } else if (AlertsApi.UPDATE_SKIPPED_ALERTS.equals(operationName)) {
      newStatus = AlertStatus.SKIPPED;
    } else {
      logger.warning("Unknown operation: " + operationName);
      return CommandResult.failure("Unknown operation: " + operationName);
    }

    String tableName;
    List<String> alertIds;
    try {
      Map<String, Object> args = jsonCodec.parseObject(payloadJson);
      tableName = TableNames.validate(stringArg(args, AlertsApi.TABLE_NAME_ARG));
      alertIds = alertIds(args);
    } catch (IllegalArgumentException e) {
      logger.warning(operationName + ": rejected payload: " + e.getMessage());
      return CommandResult.failure("Invalid payload: " + e.getMessage());
    }
    int updated = newStatus == AlertStatus.SENT
        ? markSent(alertIds, tableName)
        : markSkipped(alertIds, tableName);
    return CommandResult.success(String.valueOf(updated));
  }

  /**
   * Marks pending alerts as sent at the current clock time.
   *
   * @param alertIds  ids to update
   * @param tableName alert table
   * @return number of rows changed
   */
  public int markSent(List<String> alertIds, String tableName) {
    return updateStatus(alertIds, tableName, AlertStatus.SENT);
  }

  /**
   * Marks pending alerts as skipped. {@code sent_at} is left untouched.
   *
   * @param alertIds  ids to update
   * @param tableName alert table
   * @return number of rows changed
   */
  public int markSkipped(List<String> alertIds, String tableName) {
    return updateStatus(alertIds, tableName, AlertStatus.SKIPPED);
  }

  private int updateStatus(List<String> alertIds, String tableName, AlertStatus newStatus) {
    Objects.requireNonNull(alertIds, "alertIds");
    TableNames.validate(tableName);
    if (alertIds.isEmpty()) {
      return 0;
    }

    String placeholders = JdbcTemplate.placeholders(alertIds.size());
    List<Object> params = new ArrayList<>(alertIds.size() + 3);
    String sql;
    if (newStatus == AlertStatus.SENT) {
      sql = "UPDATE " + tableName + " SET status = ?, sent_at = ? WHERE status = ? AND alert_id IN ("
          + placeholders + ")";
      params.add(newStatus);
      params.add(clock.instant());
    } else {
      sql = "UPDATE " + tableName + " SET status = ? WHERE status = ? AND alert_id IN (" + placeholders + ")";
      params.add(newStatus);
    }
    params.add(AlertStatus.PENDING);
    params.addAll(alertIds);

    int updated;
    try (Connection conn = connectionProvider.getConnection()) {
      updated = JdbcTemplate.update(conn, sql, params.toArray());
    } catch (SQLException e) {
      throw new AlertStoreException("Failed to mark alerts " + newStatus.value() + " in " + tableName, e);
    }
    if (updated < alertIds.size()) {
      logger.fine((alertIds.size() - updated) + " of " + alertIds.size()
          + " alerts were not pending in " + tableName);
    }
    return updated;
  }

  private static String stringArg(Map<String, Object> args, String name) {
    Object value = args.get(name);
    if (!(value instanceof String s)) {
      throw new IllegalArgumentException("Missing string argument '" + name + "'");
    }
    return s;
  }

  private static List<String> alertIds(Map<String, Object> args) {
    Object value = args.get(ALERT_IDS_ARG);
    if (!(value instanceof List<?> list)) {
      throw new IllegalArgumentException("Missing array argument '" + ALERT_IDS_ARG + "'");
    }
    List<String> ids = new ArrayList<>(list.size());
    for (Object id : list) {
      if (!(id instanceof String s)) {
        throw new IllegalArgumentException("Alert ids must be strings, got " + id);
      }
      ids.add(s);
    }
    return ids;
  }
}
