package alertgate.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate result of one {@link ChunkedDispatcher} call: one {@link ChunkOutcome} per chunk,
 * in chunk order.
 *
 * <p>The dispatcher never retries. Callers decide from {@link #status()} or
 * {@link #failedChunks()} whether to retry specific chunks or fail the whole operation.
 *
 * @param operationName the remote operation that was invoked
 * @param chunks        per-chunk outcomes, ordered by chunk index
 * @param <T>           item type
 */
public record DispatchOutcome<T>(String operationName, List<ChunkOutcome<T>> chunks) {

  /** Overall result of a dispatch call. */
  public enum Status {
    /** Nothing to dispatch; no remote call was made. */
    EMPTY,
    SUCCEEDED,
    /** At least one chunk succeeded and at least one failed. */
    PARTIALLY_FAILED,
    FAILED
  }

  public DispatchOutcome {
    Objects.requireNonNull(operationName, "operationName");
    chunks = List.copyOf(chunks);
  }

  public static <T> DispatchOutcome<T> empty(String operationName) {
    return new DispatchOutcome<>(operationName, List.of());
  }

  public Status status() {
    if (chunks.isEmpty()) {
      return Status.EMPTY;
    }
    int failed = failedCount();
    if (failed == 0) {
      return Status.SUCCEEDED;
    }
    return failed == chunks.size() ? Status.FAILED : Status.PARTIALLY_FAILED;
  }

  /**
   * Returns {@code true} if no chunk failed. An empty dispatch counts as successful.
   */
  public boolean isSuccess() {
    return failedCount() == 0;
  }

  public int chunkCount() {
    return chunks.size();
  }

  public int failedCount() {
    int failed = 0;
    for (ChunkOutcome<T> chunk : chunks) {
      if (!chunk.success()) {
        failed++;
      }
    }
    return failed;
  }

  public List<ChunkOutcome<T>> failedChunks() {
    List<ChunkOutcome<T>> failed = new ArrayList<>();
    for (ChunkOutcome<T> chunk : chunks) {
      if (!chunk.success()) {
        failed.add(chunk);
      }
    }
    return Collections.unmodifiableList(failed);
  }

  /**
   * Items of every failed chunk, in input order.
   */
  public List<T> failedItems() {
    List<T> items = new ArrayList<>();
    for (ChunkOutcome<T> chunk : chunks) {
      if (!chunk.success()) {
        items.addAll(chunk.items());
      }
    }
    return Collections.unmodifiableList(items);
  }

  public int itemCount() {
    int count = 0;
    for (ChunkOutcome<T> chunk : chunks) {
      count += chunk.items().size();
    }
    return count;
  }
}
