package alertgate.micrometer;

import alertgate.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code alertgate.suppression.suppressed}: alerts withheld as already reported</li>
 *   <li>{@code alertgate.suppression.unkeyed}: alerts let through without an identity key
 *       or detection time</li>
 *   <li>{@code alertgate.dispatch.chunk.success}: chunks the executor applied</li>
 *   <li>{@code alertgate.dispatch.chunk.failure}: chunks that failed</li>
 *   <li>{@code alertgate.dispatch.items}: items sent through the dispatcher</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code alertgate.dispatch.last.failed.chunks}: failed chunks in the latest dispatch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter suppressed;
  private final Counter unkeyed;
  private final Counter chunkSuccess;
  private final Counter chunkFailure;
  private final Counter dispatchedItems;
  private final Gauge lastFailedChunksGauge;

  private final AtomicInteger lastFailedChunks = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "alertgate"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "alertgate");
  }

  /**
   * Creates an exporter with a custom metric name prefix, e.g. one per monitored project.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "warehouse.alertgate"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.suppressed = Counter.builder(namePrefix + ".suppression.suppressed")
        .description("Alerts withheld because they were already reported")
        .register(registry);
    this.unkeyed = Counter.builder(namePrefix + ".suppression.unkeyed")
        .description("Alerts passed through without identity key or detection time")
        .register(registry);
    this.chunkSuccess = Counter.builder(namePrefix + ".dispatch.chunk.success")
        .description("Chunks applied by the command executor")
        .register(registry);
    this.chunkFailure = Counter.builder(namePrefix + ".dispatch.chunk.failure")
        .description("Chunks that failed")
        .register(registry);
    this.dispatchedItems = Counter.builder(namePrefix + ".dispatch.items")
        .description("Items sent through the dispatcher")
        .register(registry);

    this.lastFailedChunksGauge = Gauge.builder(namePrefix + ".dispatch.last.failed.chunks",
            lastFailedChunks, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementSuppressed(int count) {
    if (closed) return;
    suppressed.increment(count);
  }

  @Override
  public void incrementUnkeyedAlert() {
    if (closed) return;
    unkeyed.increment();
  }

  @Override
  public void incrementChunkSuccess() {
    if (closed) return;
    chunkSuccess.increment();
  }

  @Override
  public void incrementChunkFailure() {
    if (closed) return;
    chunkFailure.increment();
  }

  @Override
  public void recordDispatchedItems(int count) {
    if (closed) return;
    dispatchedItems.increment(count);
  }

  @Override
  public void recordFailedChunks(int failedChunks) {
    if (closed) return;
    lastFailedChunks.set(failedChunks);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(suppressed, unkeyed, chunkSuccess, chunkFailure,
        dispatchedItems, lastFailedChunksGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
