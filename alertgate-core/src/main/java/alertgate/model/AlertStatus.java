package alertgate.model;

public enum AlertStatus {
  PENDING("pending"),
  SENT("sent"),
  SKIPPED("skipped");

  private final String value;

  AlertStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
