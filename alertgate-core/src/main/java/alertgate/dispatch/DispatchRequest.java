package alertgate.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Full description of one dispatch call: what to send, to which remote operation, and how to
 * shape each chunk's payload.
 *
 * <p>Create instances via {@link #builder(String, List)}. For the common case of sending a
 * list of ids, {@link ChunkedDispatcher#dispatch(List, String)} builds the request itself.
 *
 * @param <T> item type
 */
public final class DispatchRequest<T> {
  private final String operationName;
  private final List<T> items;
  private final Integer chunkSize;
  private final String itemsKey;
  private final Map<String, Object> fixedArgs;
  private final Function<? super T, ?> itemMapper;

  private DispatchRequest(Builder<T> builder) {
    this.operationName = builder.operationName;
    // snapshot; null items are allowed
    this.items = Collections.unmodifiableList(new ArrayList<>(builder.items));
    this.chunkSize = builder.chunkSize;
    this.itemsKey = builder.itemsKey;
    this.fixedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fixedArgs));
    this.itemMapper = builder.itemMapper;
  }

  public static <T> Builder<T> builder(String operationName, List<T> items) {
    return new Builder<>(operationName, items);
  }

  public String operationName() {
    return operationName;
  }

  /**
   * Items captured when the request was built; later changes to the caller's list are not seen.
   */
  public List<T> items() {
    return items;
  }

  /**
   * Requested chunk size, or {@code null} to use the dispatcher's default.
   */
  public Integer chunkSize() {
    return chunkSize;
  }

  public String itemsKey() {
    return itemsKey;
  }

  public Map<String, Object> fixedArgs() {
    return fixedArgs;
  }

  public Function<? super T, ?> itemMapper() {
    return itemMapper;
  }

  /** Builder for {@link DispatchRequest}. */
  public static final class Builder<T> {
    private final String operationName;
    private final List<T> items;
    private Integer chunkSize;
    private String itemsKey = ChunkedDispatcher.DEFAULT_ITEMS_KEY;
    private final Map<String, Object> fixedArgs = new LinkedHashMap<>();
    private Function<? super T, ?> itemMapper = Function.identity();

    private Builder(String operationName, List<T> items) {
      this.operationName = operationName;
      this.items = items;
    }

    /**
     * Overrides the dispatcher's default chunk size for this call. Must be &gt; 0.
     */
    public Builder<T> chunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    /**
     * Sets the payload key holding each chunk's items. Defaults to {@code alert_ids}.
     */
    public Builder<T> itemsKey(String itemsKey) {
      this.itemsKey = itemsKey;
      return this;
    }

    /**
     * Adds an argument copied verbatim into every chunk's payload (e.g. {@code table_name}).
     */
    public Builder<T> fixedArg(String name, Object value) {
      Objects.requireNonNull(name, "name");
      this.fixedArgs.put(name, value);
      return this;
    }

    /**
     * Sets how each item is rendered into the payload. Defaults to the item itself.
     */
    public Builder<T> itemMapper(Function<? super T, ?> itemMapper) {
      this.itemMapper = Objects.requireNonNull(itemMapper, "itemMapper");
      return this;
    }

    /**
     * Builds the request.
     *
     * @throws NullPointerException     if the operation name, items or items key is null
     * @throws IllegalArgumentException if the operation name or items key is blank, the
     *     chunk size is &le; 0, or a fixed argument reuses the items key
     */
    public DispatchRequest<T> build() {
      Objects.requireNonNull(operationName, "operationName");
      Objects.requireNonNull(items, "items");
      Objects.requireNonNull(itemsKey, "itemsKey");
      if (operationName.isBlank()) {
        throw new IllegalArgumentException("operationName must not be blank");
      }
      if (itemsKey.isBlank()) {
        throw new IllegalArgumentException("itemsKey must not be blank");
      }
      if (chunkSize != null && chunkSize <= 0) {
        throw new IllegalArgumentException("chunkSize must be > 0, got " + chunkSize);
      }
      if (fixedArgs.containsKey(itemsKey)) {
        throw new IllegalArgumentException("fixed argument '" + itemsKey + "' clashes with the items key");
      }
      return new DispatchRequest<>(this);
    }
  }
}
