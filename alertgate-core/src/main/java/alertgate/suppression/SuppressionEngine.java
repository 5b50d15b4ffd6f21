package alertgate.suppression;

import alertgate.model.Alert;
import alertgate.model.LastSentRecord;
import alertgate.spi.MetricsExporter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Computes which pending alerts were already reported and must not be notified again.
 *
 * <p>An alert is suppressed iff the last-sent snapshot has an entry for its identity key, the
 * snapshot is of the same kind as the alert, and the {@link SuppressionPolicy} says the entry
 * covers the alert. Alerts that cannot be evaluated (no identity key, no detection time) are
 * let through and logged.
 *
 * <p>The engine does no I/O and holds no mutable state; one instance can serve any number of
 * concurrent passes.
 */
public final class SuppressionEngine {
  private static final Logger logger = Logger.getLogger(SuppressionEngine.class.getName());

  private final SuppressionPolicy policy;
  private final MetricsExporter metrics;

  public SuppressionEngine() {
    this(SuppressionPolicy.sentAtOrAfterDetection(), MetricsExporter.NOOP);
  }

  public SuppressionEngine(SuppressionPolicy policy) {
    this(policy, MetricsExporter.NOOP);
  }

  public SuppressionEngine(SuppressionPolicy policy, MetricsExporter metrics) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the ids of suppressed alerts, in input order.
   *
   * @param pendingAlerts alerts of the current evaluation run, may be empty
   * @param lastSent      last-sent snapshot for the same kind
   * @return ids of alerts to withhold (unmodifiable)
   */
  public List<String> suppress(List<Alert> pendingAlerts, LastSentRecord lastSent) {
    Objects.requireNonNull(pendingAlerts, "pendingAlerts");
    Objects.requireNonNull(lastSent, "lastSent");
    if (pendingAlerts.isEmpty()) {
      return List.of();
    }

    List<String> suppressed = new ArrayList<>();
    for (Alert alert : pendingAlerts) {
      if (isSuppressed(alert, lastSent)) {
        suppressed.add(alert.id());
      }
    }
    metrics.incrementSuppressed(suppressed.size());
    logger.fine(() -> "Suppressed " + suppressed.size() + " of " + pendingAlerts.size()
        + " pending " + lastSent.kind() + " alerts");
    return Collections.unmodifiableList(suppressed);
  }

  private boolean isSuppressed(Alert alert, LastSentRecord lastSent) {
    if (!alert.isComplete()) {
      metrics.incrementUnkeyedAlert();
      logger.warning("Alert " + alert.id() + " has no identity key or detection time;"
          + " it will be notified");
      return false;
    }
    if (alert.kind() != lastSent.kind()) {
      logger.warning("Alert " + alert.id() + " of kind " + alert.kind()
          + " evaluated against " + lastSent.kind() + " send history; not suppressed");
      return false;
    }
    Optional<Instant> sentAt = lastSent.sentAt(alert.identityKey());
    return sentAt.isPresent() && policy.isCovered(alert, sentAt.get());
  }
}
