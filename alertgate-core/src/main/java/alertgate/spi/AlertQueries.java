package alertgate.spi;

import alertgate.model.Alert;
import alertgate.model.AlertKind;
import alertgate.model.LastSentRecord;

import java.util.List;

/**
 * Read side of the alert store. Implementations live in the {@code alertgate-jdbc} module.
 *
 * <p>Both methods are expected to propagate store failures as unchecked exceptions rather
 * than return partial data.
 *
 * @see alertgate.AlertsApi
 */
public interface AlertQueries {

  /**
   * Returns the latest send time per identity key for alerts of the given kind.
   *
   * @param kind the alert kind
   * @return last-sent snapshot, never {@code null}
   */
  LastSentRecord queryLastSentTimes(AlertKind kind);

  /**
   * Returns alerts of the given kind still waiting to be notified, oldest first.
   *
   * @param kind the alert kind
   * @return pending alerts, never {@code null}
   */
  List<Alert> queryPendingAlerts(AlertKind kind);
}
