package alertgate.spi;

/**
 * Observability hook for suppression and dispatch counters.
 *
 * <p>The {@link #NOOP} instance discards everything. See {@code alertgate-micrometer}
 * for a Micrometer bridge.
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  /**
   * Adds to the count of alerts withheld by one suppression pass.
   *
   * @param count number of suppressed alerts (may be zero)
   */
  void incrementSuppressed(int count);

  /**
   * Increments the count of alerts that could not be evaluated (no identity key or no
   * detection time) and were let through.
   */
  void incrementUnkeyedAlert();

  void incrementChunkSuccess();

  void incrementChunkFailure();

  /**
   * Adds to the count of items sent through the dispatcher, whatever the chunk outcome.
   *
   * @param count number of items
   */
  void recordDispatchedItems(int count);

  /**
   * Records how many chunks failed in the most recent dispatch call.
   *
   * @param failedChunks failed chunk count
   */
  default void recordFailedChunks(int failedChunks) {
  }

  final class Noop implements MetricsExporter {
    @Override
    public void incrementSuppressed(int count) {
    }

    @Override
    public void incrementUnkeyedAlert() {
    }

    @Override
    public void incrementChunkSuccess() {
    }

    @Override
    public void incrementChunkFailure() {
    }

    @Override
    public void recordDispatchedItems(int count) {
    }
  }
}
