package alertgate.dispatch;

/**
 * Hook around each remote call made by {@link ChunkedDispatcher}.
 *
 * <p>{@link #beforeChunk} runs in registration order before the call and
 * {@link #afterChunk} in reverse order after it. If {@code beforeChunk} throws, the call is
 * not made and the chunk is recorded as failed. {@code afterChunk} exceptions are logged but
 * swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ChunkedDispatcher.builder()
 *     .commandExecutor(executor)
 *     .interceptor(ChunkInterceptor.after(outcome -> {
 *       if (!outcome.success()) audit.record(outcome.operationName(), outcome.items());
 *     }))
 *     .build();
 * }</pre>
 */
public interface ChunkInterceptor {

  /**
   * Called before the chunk's remote call.
   *
   * @param operationName the remote operation about to be invoked
   * @param chunk         the chunk about to be sent
   * @throws Exception to skip the call and fail the chunk
   */
  default void beforeChunk(String operationName, Chunk<?> chunk) throws Exception {
  }

  /**
   * Called after the chunk's remote call, or after a {@code beforeChunk} failure.
   *
   * @param outcome the chunk's outcome
   */
  default void afterChunk(ChunkOutcome<?> outcome) {
  }

  /**
   * Creates an interceptor with only a {@code beforeChunk} hook.
   */
  static ChunkInterceptor before(BeforeHook hook) {
    return new ChunkInterceptor() {
      @Override
      public void beforeChunk(String operationName, Chunk<?> chunk) throws Exception {
        hook.accept(operationName, chunk);
      }
    };
  }

  /**
   * Creates an interceptor with only an {@code afterChunk} hook.
   */
  static ChunkInterceptor after(AfterHook hook) {
    return new ChunkInterceptor() {
      @Override
      public void afterChunk(ChunkOutcome<?> outcome) {
        hook.accept(outcome);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(String operationName, Chunk<?> chunk) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(ChunkOutcome<?> outcome);
  }
}
