package alertgate.model;

/**
 * Source of an alert. Each kind is stored, queried and suppressed on its own.
 */
public enum AlertKind {
  /** Failed or warning data test result. */
  TEST("alerts"),
  /** Failed model run. */
  MODEL("alerts_models");

  private final String defaultTableName;

  AlertKind(String defaultTableName) {
    this.defaultTableName = defaultTableName;
  }

  /**
   * Name of the table that holds alerts of this kind unless configured otherwise.
   */
  public String defaultTableName() {
    return defaultTableName;
  }
}
