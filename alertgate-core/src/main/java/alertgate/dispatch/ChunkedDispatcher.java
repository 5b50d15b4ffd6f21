package alertgate.dispatch;

import alertgate.spi.CommandExecutor;
import alertgate.spi.CommandResult;
import alertgate.spi.MetricsExporter;
import alertgate.util.DaemonThreadFactory;
import alertgate.util.JsonCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits a list into bounded chunks and issues one {@link CommandExecutor} call per chunk.
 *
 * <p>Each chunk's payload is a JSON object holding the chunk under the items key (default
 * {@code alert_ids}) plus the request's fixed arguments. Every chunk is attempted: a failed
 * call, a thrown exception or a failing interceptor marks that chunk failed and dispatch moves
 * on. Outcomes are returned in chunk order. No retries are made.
 *
 * <p>By default chunks run sequentially on the calling thread. With {@code parallelism > 1}
 * they run on a pool of daemon workers owned by the dispatcher; outcomes are still reassembled
 * in chunk order. Close the dispatcher to release the pool.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see DispatchRequest
 * @see DispatchOutcome
 */
public final class ChunkedDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChunkedDispatcher.class.getName());

  public static final int DEFAULT_CHUNK_SIZE = 50;
  public static final String DEFAULT_ITEMS_KEY = "alert_ids";

  private final CommandExecutor commandExecutor;
  private final JsonCodec jsonCodec;
  private final MetricsExporter metrics;
  private final List<ChunkInterceptor> interceptors;
  private final int defaultChunkSize;
  private final int parallelism;
  private final ExecutorService workers;

  private ChunkedDispatcher(Builder builder) {
    this.commandExecutor = Objects.requireNonNull(builder.commandExecutor, "commandExecutor");
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));

    if (builder.defaultChunkSize <= 0) {
      throw new IllegalArgumentException("defaultChunkSize must be > 0");
    }
    if (builder.parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1");
    }
    this.defaultChunkSize = builder.defaultChunkSize;
    this.parallelism = builder.parallelism;
    this.workers = parallelism > 1
        ? Executors.newFixedThreadPool(parallelism, new DaemonThreadFactory("alertgate-dispatch-"))
        : null;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int defaultChunkSize() {
    return defaultChunkSize;
  }

  /**
   * Dispatches {@code items} to {@code operationName} using the default chunk size.
   *
   * @param items         items to send, may be empty
   * @param operationName remote operation name
   * @return per-chunk outcomes
   */
  public <T> DispatchOutcome<T> dispatch(List<T> items, String operationName) {
    return dispatch(DispatchRequest.builder(operationName, items).build());
  }

  /**
   * Dispatches {@code items} to {@code operationName} in chunks of {@code chunkSize}.
   *
   * @throws IllegalArgumentException if {@code chunkSize <= 0}
   */
  public <T> DispatchOutcome<T> dispatch(List<T> items, String operationName, int chunkSize) {
    return dispatch(DispatchRequest.builder(operationName, items).chunkSize(chunkSize).build());
  }

  /**
   * Dispatches a fully described request.
   *
   * @param request the request
   * @return per-chunk outcomes in chunk order; empty when there are no items
   */
  public <T> DispatchOutcome<T> dispatch(DispatchRequest<T> request) {
    Objects.requireNonNull(request, "request");
    String operationName = request.operationName();
    int chunkSize = request.chunkSize() != null ? request.chunkSize() : defaultChunkSize;
    List<Chunk<T>> chunks = Chunk.split(request.items(), chunkSize);
    if (chunks.isEmpty()) {
      return DispatchOutcome.empty(operationName);
    }

    List<ChunkOutcome<T>> outcomes = workers == null || chunks.size() == 1
        ? runSequentially(chunks, request)
        : runInParallel(chunks, request);

    DispatchOutcome<T> outcome = new DispatchOutcome<>(operationName, outcomes);
    metrics.recordDispatchedItems(outcome.itemCount());
    metrics.recordFailedChunks(outcome.failedCount());
    if (!outcome.isSuccess()) {
      logger.warning(operationName + ": " + outcome.failedCount() + " of " + outcome.chunkCount()
          + " chunks failed");
    }
    return outcome;
  }

  private <T> List<ChunkOutcome<T>> runSequentially(List<Chunk<T>> chunks, DispatchRequest<T> request) {
    List<ChunkOutcome<T>> outcomes = new ArrayList<>(chunks.size());
    for (Chunk<T> chunk : chunks) {
      outcomes.add(runChunk(chunk, request));
    }
    return outcomes;
  }

  private <T> List<ChunkOutcome<T>> runInParallel(List<Chunk<T>> chunks, DispatchRequest<T> request) {
    List<Future<ChunkOutcome<T>>> futures = new ArrayList<>(chunks.size());
    for (Chunk<T> chunk : chunks) {
      futures.add(workers.submit(() -> runChunk(chunk, request)));
    }
    List<ChunkOutcome<T>> outcomes = new ArrayList<>(chunks.size());
    boolean interrupted = false;
    for (int i = 0; i < futures.size(); i++) {
      Chunk<T> chunk = chunks.get(i);
      try {
        if (interrupted) {
          // chunk keeps running on its worker; its result is no longer awaited
          outcomes.add(ChunkOutcome.failed(chunk, request.operationName(), null,
              "interrupted while awaiting result"));
          continue;
        }
        outcomes.add(futures.get(i).get());
      } catch (InterruptedException e) {
        interrupted = true;
        outcomes.add(ChunkOutcome.failed(chunk, request.operationName(), null,
            "interrupted while awaiting result"));
      } catch (ExecutionException e) {
        outcomes.add(ChunkOutcome.failed(chunk, request.operationName(), null, describe(e.getCause())));
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return outcomes;
  }

  private <T> ChunkOutcome<T> runChunk(Chunk<T> chunk, DispatchRequest<T> request) {
    String operationName = request.operationName();
    int completedBefore = 0;
    ChunkOutcome<T> outcome;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeChunk(operationName, chunk);
        completedBefore = i + 1;
      }
      String payload = jsonCodec.toJson(payloadFor(chunk, request));
      logger.fine(() -> operationName + " chunk " + chunk.index() + ": " + chunk.size() + " items");
      CommandResult result = commandExecutor.execute(operationName, payload);
      if (result == null) {
        outcome = ChunkOutcome.failed(chunk, operationName, null, "command executor returned no result");
      } else if (result.success()) {
        outcome = ChunkOutcome.succeeded(chunk, operationName, result.output());
      } else {
        outcome = ChunkOutcome.failed(chunk, operationName, result.output(), "remote operation reported failure");
      }
    } catch (Exception e) {
      logger.log(Level.SEVERE, operationName + " chunk " + chunk.index() + " failed", e);
      outcome = ChunkOutcome.failed(chunk, operationName, null, describe(e));
    }

    if (outcome.success()) {
      metrics.incrementChunkSuccess();
    } else {
      metrics.incrementChunkFailure();
    }
    runAfterChunk(outcome, completedBefore);
    return outcome;
  }

  private <T> Map<String, Object> payloadFor(Chunk<T> chunk, DispatchRequest<T> request) {
    List<Object> rendered = new ArrayList<>(chunk.size());
    for (T item : chunk.items()) {
      rendered.add(request.itemMapper().apply(item));
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(request.itemsKey(), rendered);
    payload.putAll(request.fixedArgs());
    return payload;
  }

  private void runAfterChunk(ChunkOutcome<?> outcome, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterChunk(outcome);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterChunk failed", ex);
      }
    }
  }

  private static String describe(Throwable t) {
    if (t == null) {
      return "unknown error";
    }
    return t.getMessage() == null ? t.getClass().getName() : t.getClass().getSimpleName() + ": " + t.getMessage();
  }

  /**
   * Shuts down the worker pool, waiting briefly for running chunks. No-op for a sequential
   * dispatcher.
   */
  @Override
  public void close() {
    if (workers == null) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Dispatch workers did not terminate in time; forcing shutdown");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link ChunkedDispatcher}. */
  public static final class Builder {
    private CommandExecutor commandExecutor;
    private JsonCodec jsonCodec;
    private MetricsExporter metrics;
    private final List<ChunkInterceptor> interceptors = new ArrayList<>();
    private int defaultChunkSize = DEFAULT_CHUNK_SIZE;
    private int parallelism = 1;

    private Builder() {}

    /**
     * Sets the executor that runs the remote operation for each chunk.
     *
     * <p><b>Required.</b>
     */
    public Builder commandExecutor(CommandExecutor commandExecutor) {
      this.commandExecutor = commandExecutor;
      return this;
    }

    /**
     * Sets the codec used to encode chunk payloads.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets the metrics exporter for chunk counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends an interceptor run around every chunk call.
     */
    public Builder interceptor(ChunkInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Appends interceptors run around every chunk call, in list order.
     */
    public Builder interceptors(List<ChunkInterceptor> interceptors) {
      for (ChunkInterceptor interceptor : Objects.requireNonNull(interceptors, "interceptors")) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Sets the chunk size used when a request does not specify one.
     *
     * <p>Optional. Defaults to {@value ChunkedDispatcher#DEFAULT_CHUNK_SIZE}. Must be &gt; 0.
     */
    public Builder defaultChunkSize(int defaultChunkSize) {
      this.defaultChunkSize = defaultChunkSize;
      return this;
    }

    /**
     * Sets how many chunks may be in flight at once.
     *
     * <p>Optional. Defaults to {@code 1} (sequential, no worker threads). Must be &ge; 1.
     */
    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    /**
     * Builds the dispatcher.
     *
     * @throws NullPointerException     if {@code commandExecutor} is null
     * @throws IllegalArgumentException if {@code defaultChunkSize <= 0} or {@code parallelism < 1}
     */
    public ChunkedDispatcher build() {
      return new ChunkedDispatcher(this);
    }
  }
}
