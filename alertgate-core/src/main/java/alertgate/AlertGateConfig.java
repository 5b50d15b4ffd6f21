package alertgate;

import alertgate.model.AlertKind;
import alertgate.suppression.SuppressionPolicy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Plain-Java settings for {@link AlertsApi}. Values are checked once, when the API is built.
 */
public final class AlertGateConfig {
  private int chunkSize = 50;
  private int parallelism = 1;

  private SuppressionPolicy.Mode suppressionMode = SuppressionPolicy.Mode.SENT_AT_OR_AFTER_DETECTION;
  private Duration defaultSuppressionInterval = Duration.ofHours(24);
  private boolean deduplicate = true;

  private final Map<AlertKind, String> tableNames = new EnumMap<>(AlertKind.class);

  public AlertGateConfig() {
    for (AlertKind kind : AlertKind.values()) {
      tableNames.put(kind, kind.defaultTableName());
    }
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public AlertGateConfig setChunkSize(int chunkSize) {
    this.chunkSize = chunkSize;
    return this;
  }

  public int getParallelism() {
    return parallelism;
  }

  public AlertGateConfig setParallelism(int parallelism) {
    this.parallelism = parallelism;
    return this;
  }

  public SuppressionPolicy.Mode getSuppressionMode() {
    return suppressionMode;
  }

  public AlertGateConfig setSuppressionMode(SuppressionPolicy.Mode suppressionMode) {
    this.suppressionMode = suppressionMode;
    return this;
  }

  public Duration getDefaultSuppressionInterval() {
    return defaultSuppressionInterval;
  }

  public AlertGateConfig setDefaultSuppressionInterval(Duration defaultSuppressionInterval) {
    this.defaultSuppressionInterval = defaultSuppressionInterval;
    return this;
  }

  public boolean isDeduplicate() {
    return deduplicate;
  }

  /**
   * Whether only the latest alert per identity key is notified; older ones are skipped.
   */
  public AlertGateConfig setDeduplicate(boolean deduplicate) {
    this.deduplicate = deduplicate;
    return this;
  }

  public String getTableName(AlertKind kind) {
    return tableNames.get(kind);
  }

  public AlertGateConfig setTableName(AlertKind kind, String tableName) {
    Objects.requireNonNull(kind, "kind");
    this.tableNames.put(kind, Objects.requireNonNull(tableName, "tableName"));
    return this;
  }
}
