package alertgate.dispatch;

import java.util.List;
import java.util.Objects;

/**
 * Result of the remote call made for one chunk.
 *
 * @param chunkIndex    position of the chunk within its dispatch call
 * @param operationName the remote operation that was invoked
 * @param items         the chunk contents
 * @param success       whether the call succeeded
 * @param response      raw executor output, may be {@code null}
 * @param error         failure description, {@code null} on success
 * @param <T>           item type
 */
public record ChunkOutcome<T>(
    int chunkIndex,
    String operationName,
    List<T> items,
    boolean success,
    String response,
    String error
) {

  public ChunkOutcome {
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(items, "items");
  }

  static <T> ChunkOutcome<T> succeeded(Chunk<T> chunk, String operationName, String response) {
    return new ChunkOutcome<>(chunk.index(), operationName, chunk.items(), true, response, null);
  }

  static <T> ChunkOutcome<T> failed(Chunk<T> chunk, String operationName, String response, String error) {
    return new ChunkOutcome<>(chunk.index(), operationName, chunk.items(), false, response,
        error == null ? "unknown error" : error);
  }
}
