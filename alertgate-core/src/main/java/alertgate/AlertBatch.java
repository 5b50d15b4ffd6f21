package alertgate;

import alertgate.dispatch.DispatchOutcome;
import alertgate.model.Alert;
import alertgate.model.AlertKind;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link AlertsApi#getNewAlerts(AlertKind)}.
 *
 * @param kind          alert kind that was evaluated
 * @param toSend        alerts to hand to the notifiers, in store order
 * @param suppressedIds ids withheld because they were already reported
 * @param skipped       every alert marked skipped (suppressed or superseded)
 * @param skipOutcome   result of the {@code update_skipped_alerts} dispatch
 */
public record AlertBatch(
    AlertKind kind,
    List<Alert> toSend,
    List<String> suppressedIds,
    List<Alert> skipped,
    DispatchOutcome<Alert> skipOutcome
) {

  public AlertBatch {
    Objects.requireNonNull(kind, "kind");
    toSend = List.copyOf(toSend);
    suppressedIds = List.copyOf(suppressedIds);
    skipped = List.copyOf(skipped);
    Objects.requireNonNull(skipOutcome, "skipOutcome");
  }
}
