package alertgate;

import alertgate.dispatch.ChunkInterceptor;
import alertgate.dispatch.ChunkedDispatcher;
import alertgate.dispatch.DispatchOutcome;
import alertgate.dispatch.DispatchRequest;
import alertgate.model.Alert;
import alertgate.model.AlertKind;
import alertgate.model.LastSentRecord;
import alertgate.spi.AlertQueries;
import alertgate.spi.CommandExecutor;
import alertgate.spi.MetricsExporter;
import alertgate.suppression.AlertDeduplicator;
import alertgate.suppression.SuppressionEngine;
import alertgate.suppression.SuppressionPolicy;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Entry point tying queries, suppression and chunked dispatch together for one alert kind.
 *
 * <p>{@link #getNewAlerts(AlertKind)} reads pending alerts and send history, withholds alerts
 * that were already reported, keeps only the latest occurrence of each check, marks everything
 * withheld as skipped in the store and returns the rest. After the notifiers ran, the caller
 * reports what went out through {@link #updateSentAlerts(List, AlertKind)}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (AlertsApi api = AlertsApi.builder()
 *     .alertQueries(new JdbcAlertQueries(connectionProvider))
 *     .commandExecutor(new JdbcCommandExecutor(connectionProvider))
 *     .config(new AlertGateConfig().setChunkSize(100))
 *     .build()) {
 *
 *   AlertBatch batch = api.getNewAlerts(AlertKind.TEST);
 *   List<String> sent = notifier.send(batch.toSend());
 *   api.updateSentAlerts(sent, AlertKind.TEST);
 * }
 * }</pre>
 */
public final class AlertsApi implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AlertsApi.class.getName());

  public static final String UPDATE_SENT_ALERTS = "update_sent_alerts";
  public static final String UPDATE_SKIPPED_ALERTS = "update_skipped_alerts";
  public static final String TABLE_NAME_ARG = "table_name";

  private final AlertQueries alertQueries;
  private final SuppressionEngine suppressionEngine;
  private final ChunkedDispatcher dispatcher;
  private final boolean ownsDispatcher;
  private final boolean deduplicate;
  private final Map<AlertKind, String> tableNames;

  private AlertsApi(Builder builder) {
    this.alertQueries = Objects.requireNonNull(builder.alertQueries, "alertQueries");
    AlertGateConfig config = builder.config != null ? builder.config : new AlertGateConfig();
    MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    Objects.requireNonNull(config.getSuppressionMode(), "suppressionMode");
    this.suppressionEngine = builder.suppressionEngine != null
        ? builder.suppressionEngine
        : new SuppressionEngine(
            config.getSuppressionMode().toPolicy(config.getDefaultSuppressionInterval(), clock), metrics);

    if (builder.dispatcher != null) {
      this.dispatcher = builder.dispatcher;
      this.ownsDispatcher = false;
    } else {
      this.dispatcher = ChunkedDispatcher.builder()
          .commandExecutor(Objects.requireNonNull(builder.commandExecutor, "commandExecutor"))
          .defaultChunkSize(config.getChunkSize())
          .parallelism(config.getParallelism())
          .metrics(metrics)
          .interceptors(builder.interceptors)
          .build();
      this.ownsDispatcher = true;
    }

    this.deduplicate = config.isDeduplicate();
    this.tableNames = new EnumMap<>(AlertKind.class);
    for (AlertKind kind : AlertKind.values()) {
      String tableName = config.getTableName(kind);
      if (tableName == null || tableName.isBlank()) {
        throw new IllegalArgumentException("No table name configured for " + kind);
      }
      tableNames.put(kind, tableName);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the alerts of {@code kind} that should be notified now, after marking every
   * withheld alert as skipped.
   *
   * <p>A failed skip dispatch does not change which alerts are returned; it is reported in
   * {@link AlertBatch#skipOutcome()} and those alerts stay pending in the store.
   *
   * @param kind the alert kind to evaluate
   * @return alerts to send plus what was withheld
   */
  public AlertBatch getNewAlerts(AlertKind kind) {
    Objects.requireNonNull(kind, "kind");
    LastSentRecord lastSent = alertQueries.queryLastSentTimes(kind);
    List<Alert> pending = alertQueries.queryPendingAlerts(kind);

    List<String> suppressedIds = suppressionEngine.suppress(pending, lastSent);
    Set<String> suppressed = new HashSet<>(suppressedIds);
    Set<String> latest = deduplicate ? AlertDeduplicator.latestPerIdentity(pending) : null;

    List<Alert> toSend = new ArrayList<>();
    List<Alert> toSkip = new ArrayList<>();
    for (Alert alert : pending) {
      boolean superseded = latest != null && !latest.contains(alert.id());
      if (suppressed.contains(alert.id()) || superseded) {
        toSkip.add(alert);
      } else {
        toSend.add(alert);
      }
    }

    DispatchOutcome<Alert> skipOutcome = skipAlerts(toSkip, kind);
    logger.info(kind + " alerts: " + pending.size() + " pending, " + suppressedIds.size()
        + " suppressed, " + toSkip.size() + " skipped, " + toSend.size() + " to send");
    return new AlertBatch(kind, toSend, suppressedIds, toSkip, skipOutcome);
  }

  /**
   * Marks alerts as sent in the table of {@code kind}.
   */
  public DispatchOutcome<String> updateSentAlerts(List<String> alertIds, AlertKind kind) {
    return updateSentAlerts(alertIds, tableName(kind));
  }

  /**
   * Marks alerts as sent, dispatching {@value #UPDATE_SENT_ALERTS} in chunks.
   *
   * @param alertIds  ids of alerts that were notified
   * @param tableName alert table to update
   * @return per-chunk outcomes
   */
  public DispatchOutcome<String> updateSentAlerts(List<String> alertIds, String tableName) {
    return dispatcher.dispatch(DispatchRequest.builder(UPDATE_SENT_ALERTS, alertIds)
        .fixedArg(TABLE_NAME_ARG, Objects.requireNonNull(tableName, "tableName"))
        .build());
  }

  /**
   * Marks alerts as skipped in the table of {@code kind}.
   */
  public DispatchOutcome<Alert> skipAlerts(List<Alert> alerts, AlertKind kind) {
    return skipAlerts(alerts, tableName(kind));
  }

  /**
   * Marks alerts as skipped, dispatching {@value #UPDATE_SKIPPED_ALERTS} in chunks. Chunks hold
   * the alert records; each payload carries their ids.
   *
   * @param alerts    alerts to skip
   * @param tableName alert table to update
   * @return per-chunk outcomes
   */
  public DispatchOutcome<Alert> skipAlerts(List<Alert> alerts, String tableName) {
    return dispatcher.dispatch(DispatchRequest.builder(UPDATE_SKIPPED_ALERTS, alerts)
        .fixedArg(TABLE_NAME_ARG, Objects.requireNonNull(tableName, "tableName"))
        .itemMapper(Alert::id)
        .build());
  }

  public String tableName(AlertKind kind) {
    return tableNames.get(Objects.requireNonNull(kind, "kind"));
  }

  /**
   * Closes the dispatcher if this instance created it.
   */
  @Override
  public void close() {
    if (ownsDispatcher) {
      dispatcher.close();
    }
  }

  /** Builder for {@link AlertsApi}. */
  public static final class Builder {
    private AlertQueries alertQueries;
    private CommandExecutor commandExecutor;
    private ChunkedDispatcher dispatcher;
    private SuppressionEngine suppressionEngine;
    private AlertGateConfig config;
    private MetricsExporter metrics;
    private Clock clock;
    private final List<ChunkInterceptor> interceptors = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the read side of the alert store. <b>Required.</b>
     */
    public Builder alertQueries(AlertQueries alertQueries) {
      this.alertQueries = alertQueries;
      return this;
    }

    /**
     * Sets the executor for {@code update_sent_alerts} / {@code update_skipped_alerts}.
     * Required unless {@link #dispatcher(ChunkedDispatcher)} is set.
     */
    public Builder commandExecutor(CommandExecutor commandExecutor) {
      this.commandExecutor = commandExecutor;
      return this;
    }

    /**
     * Uses an existing dispatcher instead of building one from the config. The caller keeps
     * ownership and closes it.
     */
    public Builder dispatcher(ChunkedDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /**
     * Uses an existing engine instead of building one from the config's suppression mode.
     */
    public Builder suppressionEngine(SuppressionEngine suppressionEngine) {
      this.suppressionEngine = suppressionEngine;
      return this;
    }

    public Builder config(AlertGateConfig config) {
      this.config = config;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Clock for the {@link SuppressionPolicy.Mode#WITHIN_INTERVAL} policy. Defaults to UTC
     * system time.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder interceptor(ChunkInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public AlertsApi build() {
      return new AlertsApi(this);
    }
  }
}
