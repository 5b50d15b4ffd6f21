package alertgate.spi;

import alertgate.CommandExecutionException;

/**
 * Executes a named remote operation against the alert store with a JSON argument object.
 *
 * <p>This is the only write path the engine uses. Implementations may run the operation
 * in-process (see {@code alertgate.jdbc.JdbcCommandExecutor}) or out of process (see
 * {@link alertgate.command.RunOperationCommandExecutor}). Timeouts and retries belong to the
 * implementation; the dispatcher treats a thrown exception the same as a failed result.
 */
@FunctionalInterface
public interface CommandExecutor {

  /**
   * Runs one remote operation.
   *
   * @param operationName name of the remote operation (e.g. {@code update_sent_alerts})
   * @param payloadJson   JSON object holding the operation arguments
   * @return the outcome reported by the store
   * @throws CommandExecutionException if the operation could not be run at all
   */
  CommandResult execute(String operationName, String payloadJson);
}
