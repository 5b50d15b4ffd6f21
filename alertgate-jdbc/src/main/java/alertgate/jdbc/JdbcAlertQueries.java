package alertgate.jdbc;

import alertgate.model.Alert;
import alertgate.model.AlertKind;
import alertgate.model.AlertStatus;
import alertgate.model.LastSentRecord;
import alertgate.spi.AlertQueries;
import alertgate.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link AlertQueries} over one alert table per {@link AlertKind}.
 *
 * <p>Expected columns: {@code alert_id}, {@code alert_class_id}, {@code detected_at},
 * {@code status} ({@code pending}/{@code sent}/{@code skipped}), {@code sent_at} and an optional
 * {@code suppression_interval} in hours.
 *
 * <p>With {@link Builder#daysBack(int)} set, both queries only look at rows detected within
 * that many days of the clock's current time.
 */
public final class JdbcAlertQueries implements AlertQueries {

  private final ConnectionProvider connectionProvider;
  private final Map<AlertKind, String> tableNames;
  private final Integer daysBack;
  private final Clock clock;

  public JdbcAlertQueries(ConnectionProvider connectionProvider) {
    this(builder().connectionProvider(connectionProvider));
  }

  private JdbcAlertQueries(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.tableNames = new EnumMap<>(AlertKind.class);
    for (AlertKind kind : AlertKind.values()) {
      tableNames.put(kind, TableNames.validate(builder.tableNames.getOrDefault(kind, kind.defaultTableName())));
    }
    this.daysBack = builder.daysBack;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public LastSentRecord queryLastSentTimes(AlertKind kind) {
    Objects.requireNonNull(kind, "kind");
    Instant since = since();
    String sql = "SELECT alert_class_id, MAX(sent_at) AS last_sent_at FROM " + tableNames.get(kind)
        + " WHERE status = ? AND alert_class_id IS NOT NULL AND sent_at IS NOT NULL"
        + (since != null ? " AND detected_at >= ?" : "")
        + " GROUP BY alert_class_id";
    Object[] params = since != null
        ? new Object[] {AlertStatus.SENT, since}
        : new Object[] {AlertStatus.SENT};

    Map<String, Instant> lastSent = new HashMap<>();
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.forEach(conn, sql,
          rs -> lastSent.put(rs.getString("alert_class_id"), JdbcTemplate.instant(rs, "last_sent_at")),
          params);
    } catch (SQLException e) {
      throw new AlertStoreException("Failed to query last sent times for " + kind, e);
    }
    return LastSentRecord.of(kind, lastSent);
  }

  @Override
  public List<Alert> queryPendingAlerts(AlertKind kind) {
    Objects.requireNonNull(kind, "kind");
    Instant since = since();
    String sql = "SELECT alert_id, alert_class_id, detected_at, suppression_interval FROM "
        + tableNames.get(kind)
        + " WHERE status = ?"
        + (since != null ? " AND detected_at >= ?" : "")
        + " ORDER BY detected_at, alert_id";
    Object[] params = since != null
        ? new Object[] {AlertStatus.PENDING, since}
        : new Object[] {AlertStatus.PENDING};

    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.query(conn, sql, alertRowMapper(kind), params);
    } catch (SQLException e) {
      throw new AlertStoreException("Failed to query pending alerts for " + kind, e);
    }
  }

  private static JdbcTemplate.RowMapper<Alert> alertRowMapper(AlertKind kind) {
    return rs -> {
      int intervalHours = rs.getInt("suppression_interval");
      Duration interval = rs.wasNull() ? null : Duration.ofHours(intervalHours);
      return new Alert(
          rs.getString("alert_id"),
          kind,
          rs.getString("alert_class_id"),
          JdbcTemplate.instant(rs, "detected_at"),
          interval);
    };
  }

  public String tableName(AlertKind kind) {
    return tableNames.get(Objects.requireNonNull(kind, "kind"));
  }

  private Instant since() {
    return daysBack == null ? null : clock.instant().minus(Duration.ofDays(daysBack));
  }

  /** Builder for {@link JdbcAlertQueries}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private final Map<AlertKind, String> tableNames = new EnumMap<>(AlertKind.class);
    private Integer daysBack;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the connection source. <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Overrides the table for one kind. Optional. Defaults to
     * {@link AlertKind#defaultTableName()}.
     */
    public Builder tableName(AlertKind kind, String tableName) {
      this.tableNames.put(Objects.requireNonNull(kind, "kind"), tableName);
      return this;
    }

    /**
     * Limits both queries to alerts detected in the last {@code daysBack} days. Optional.
     * Unbounded by default.
     */
    public Builder daysBack(int daysBack) {
      if (daysBack <= 0) {
        throw new IllegalArgumentException("daysBack must be > 0");
      }
      this.daysBack = daysBack;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JdbcAlertQueries build() {
      return new JdbcAlertQueries(this);
    }
  }
}
