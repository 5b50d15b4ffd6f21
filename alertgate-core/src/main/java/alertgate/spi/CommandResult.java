package alertgate.spi;

/**
 * Result of one {@link CommandExecutor#execute} call.
 *
 * @param success whether the store applied the operation
 * @param output  raw response text from the executor, may be {@code null}
 */
public record CommandResult(boolean success, String output) {

  public static CommandResult success(String output) {
    return new CommandResult(true, output);
  }

  public static CommandResult failure(String output) {
    return new CommandResult(false, output);
  }
}
