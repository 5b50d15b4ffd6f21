package alertgate.suppression;

import alertgate.model.Alert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Picks one alert per identity key when the same check fired several times.
 */
public final class AlertDeduplicator {

  private AlertDeduplicator() {
  }

  /**
   * Returns the ids of the latest detected alert for each identity key, in the input order of
   * the chosen alerts. On equal detection times the alert that comes later in the input wins.
   * Alerts that cannot be evaluated are always kept.
   *
   * @param alerts pending alerts
   * @return ids to keep (unmodifiable)
   */
  public static Set<String> latestPerIdentity(List<Alert> alerts) {
    Objects.requireNonNull(alerts, "alerts");
    Map<String, Alert> latestByKey = new LinkedHashMap<>();
    List<Alert> unkeyed = new ArrayList<>();
    for (Alert alert : alerts) {
      if (!alert.isComplete()) {
        unkeyed.add(alert);
        continue;
      }
      latestByKey.merge(alert.identityKey(), alert, (current, candidate) ->
          candidate.detectedAt().isBefore(current.detectedAt()) ? current : candidate);
    }

    Set<Alert> kept = Collections.newSetFromMap(new IdentityHashMap<>());
    kept.addAll(latestByKey.values());
    kept.addAll(unkeyed);
    Set<String> ids = new LinkedHashSet<>();
    for (Alert alert : alerts) {
      if (kept.contains(alert)) {
        ids.add(alert.id());
      }
    }
    return Collections.unmodifiableSet(ids);
  }
}
