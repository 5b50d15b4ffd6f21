package alertgate;

/**
 * Thrown by a {@link alertgate.spi.CommandExecutor} when a remote operation could not be run,
 * as opposed to running and reporting failure.
 *
 * <p>The dispatcher records it as a failed chunk and carries on with the remaining chunks.
 */
public class CommandExecutionException extends RuntimeException {

  private final String operationName;

  public CommandExecutionException(String operationName, String message) {
    super(message);
    this.operationName = operationName;
  }

  public CommandExecutionException(String operationName, String message, Throwable cause) {
    super(message, cause);
    this.operationName = operationName;
  }

  /**
   * Returns the remote operation that failed.
   *
   * @return the operation name, may be {@code null}
   */
  public String operationName() {
    return operationName;
  }
}
