/**
 * Chunked dispatch of state-changing updates to the alert store.
 *
 * <p>{@link alertgate.dispatch.ChunkedDispatcher} splits a list into
 * {@link alertgate.dispatch.Chunk chunks} of bounded size and issues one remote call per chunk
 * through a {@link alertgate.spi.CommandExecutor}. Failures are isolated per chunk and reported
 * in a {@link alertgate.dispatch.DispatchOutcome}.
 *
 * @see alertgate.dispatch.DispatchRequest
 * @see alertgate.dispatch.ChunkInterceptor
 */
package alertgate.dispatch;
