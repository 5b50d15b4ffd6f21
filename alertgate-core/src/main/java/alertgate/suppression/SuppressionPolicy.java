package alertgate.suppression;

import alertgate.model.Alert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether a previous notification covers a pending alert.
 *
 * <p>The engine only consults the policy for alerts that carry an identity key and a detection
 * time and that have a last-sent entry, so implementations never see {@code null} arguments.
 *
 * @see SuppressionEngine
 */
@FunctionalInterface
public interface SuppressionPolicy {

  /**
   * Returns {@code true} if {@code sentAt} means the alert was already reported.
   *
   * @param alert  the pending alert
   * @param sentAt last notification time for the alert's identity key
   * @return whether the alert must be withheld
   */
  boolean isCovered(Alert alert, Instant sentAt);

  /**
   * Suppresses when the last send happened at or after detection ({@code sentAt >= detectedAt}).
   */
  static SuppressionPolicy sentAtOrAfterDetection() {
    return (alert, sentAt) -> !sentAt.isBefore(alert.detectedAt());
  }

  /**
   * Suppresses only when the last send happened strictly after detection.
   */
  static SuppressionPolicy sentAfterDetection() {
    return (alert, sentAt) -> sentAt.isAfter(alert.detectedAt());
  }

  /**
   * Suppresses while the last send is still inside a suppression window ending now.
   *
   * <p>The window is the alert's own {@link Alert#suppressionInterval()} when set, otherwise
   * {@code defaultInterval}.
   *
   * @param defaultInterval window for alerts without their own interval
   * @param clock           source of "now"
   */
  static SuppressionPolicy withinInterval(Duration defaultInterval, Clock clock) {
    Objects.requireNonNull(defaultInterval, "defaultInterval");
    Objects.requireNonNull(clock, "clock");
    if (defaultInterval.isNegative()) {
      throw new IllegalArgumentException("defaultInterval must not be negative");
    }
    return (alert, sentAt) -> {
      Duration interval = alert.suppressionInterval() != null
          ? alert.suppressionInterval() : defaultInterval;
      Duration elapsed = Duration.between(sentAt, clock.instant());
      return elapsed.compareTo(interval) <= 0;
    };
  }

  /** Named policies selectable from configuration. */
  enum Mode {
    SENT_AT_OR_AFTER_DETECTION,
    SENT_AFTER_DETECTION,
    WITHIN_INTERVAL;

    /**
     * Builds the policy for this mode.
     *
     * @param defaultInterval used by {@link #WITHIN_INTERVAL} only
     * @param clock           used by {@link #WITHIN_INTERVAL} only
     * @return the policy
     */
    public SuppressionPolicy toPolicy(Duration defaultInterval, Clock clock) {
      return switch (this) {
        case SENT_AT_OR_AFTER_DETECTION -> sentAtOrAfterDetection();
        case SENT_AFTER_DETECTION -> sentAfterDetection();
        case WITHIN_INTERVAL -> withinInterval(defaultInterval, clock);
      };
    }
  }
}
