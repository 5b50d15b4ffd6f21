package alertgate.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Contiguous slice of a dispatched list.
 *
 * @param index zero-based position of the chunk within its dispatch call
 * @param items the chunk contents (unmodifiable)
 * @param <T>   item type
 */
public record Chunk<T>(int index, List<T> items) {

  public Chunk {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    items = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(items, "items")));
  }

  public int size() {
    return items.size();
  }

  /**
   * Splits {@code items} into consecutive chunks of at most {@code chunkSize} elements,
   * preserving order. Only the last chunk may be smaller; an empty list yields no chunks.
   *
   * @param items     the list to split
   * @param chunkSize maximum chunk size, must be &gt; 0
   * @param <T>       item type
   * @return {@code ceil(items.size() / chunkSize)} chunks
   */
  public static <T> List<Chunk<T>> split(List<T> items, int chunkSize) {
    Objects.requireNonNull(items, "items");
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0, got " + chunkSize);
    }
    int size = items.size();
    List<Chunk<T>> chunks = new ArrayList<>(size / chunkSize + (size % chunkSize == 0 ? 0 : 1));
    for (int from = 0, index = 0; from < size; index++) {
      // long arithmetic: from + chunkSize may exceed Integer.MAX_VALUE
      int to = (int) Math.min((long) from + chunkSize, size);
      chunks.add(new Chunk<>(index, items.subList(from, to)));
      from = to;
    }
    return chunks;
  }
}
