package alertgate.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of the most recent successful notification time per identity key, for one
 * {@link AlertKind}.
 *
 * <p>Instances are immutable. The store is updated only through the {@code update_sent_alerts}
 * operation, after which a fresh snapshot has to be queried.
 */
public final class LastSentRecord {
  private final AlertKind kind;
  private final Map<String, Instant> sentAtByKey;

  private LastSentRecord(AlertKind kind, Map<String, Instant> sentAtByKey) {
    this.kind = kind;
    this.sentAtByKey = sentAtByKey;
  }

  public static LastSentRecord of(AlertKind kind, Map<String, Instant> sentAtByKey) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(sentAtByKey, "sentAtByKey");
    Map<String, Instant> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Instant> entry : sentAtByKey.entrySet()) {
      Objects.requireNonNull(entry.getKey(), "sentAtByKey cannot contain null keys");
      Objects.requireNonNull(entry.getValue(), "sentAtByKey cannot contain null values");
      copy.put(entry.getKey(), entry.getValue());
    }
    return new LastSentRecord(kind, Collections.unmodifiableMap(copy));
  }

  public static LastSentRecord empty(AlertKind kind) {
    return of(kind, Map.of());
  }

  public AlertKind kind() {
    return kind;
  }

  public Optional<Instant> sentAt(String identityKey) {
    if (identityKey == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sentAtByKey.get(identityKey));
  }

  public int size() {
    return sentAtByKey.size();
  }

  public Map<String, Instant> asMap() {
    return sentAtByKey;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LastSentRecord other)) return false;
    return kind == other.kind && sentAtByKey.equals(other.sentAtByKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, sentAtByKey);
  }

  @Override
  public String toString() {
    return "LastSentRecord{kind=" + kind + ", entries=" + sentAtByKey.size() + "}";
  }
}
