package alertgate.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One detected anomaly occurrence, as read from the alert store.
 *
 * <p>{@code id} is unique per occurrence. {@code identityKey} names the logical, recurring
 * check (table + column + test) and is what gets matched against previous sends. Rows read
 * from a store may lack an identity key or a detection time; such alerts are never suppressed.
 *
 * @param id                  unique alert id
 * @param kind                test or model alert
 * @param identityKey         logical check identity, may be {@code null}
 * @param detectedAt          time of the run that produced the alert, may be {@code null}
 * @param suppressionInterval per-alert suppression window, may be {@code null}
 */
public record Alert(
    String id,
    AlertKind kind,
    String identityKey,
    Instant detectedAt,
    Duration suppressionInterval
) {

  public Alert {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    if (suppressionInterval != null && suppressionInterval.isNegative()) {
      throw new IllegalArgumentException("suppressionInterval must not be negative");
    }
  }

  public static Alert of(String id, AlertKind kind, String identityKey, Instant detectedAt) {
    return new Alert(id, kind, identityKey, detectedAt, null);
  }

  public boolean hasIdentityKey() {
    return identityKey != null && !identityKey.isBlank();
  }

  /**
   * Whether the alert carries everything needed to compare it with a last-sent record.
   */
  public boolean isComplete() {
    return hasIdentityKey() && detectedAt != null;
  }
}
