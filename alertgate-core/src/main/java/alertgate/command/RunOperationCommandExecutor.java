package alertgate.command;

import alertgate.CommandExecutionException;
import alertgate.spi.CommandExecutor;
import alertgate.spi.CommandResult;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link CommandExecutor} that runs each operation as an external process:
 * {@code <binary> run-operation <operation> --args <json> [options]}.
 *
 * <p>A zero exit code is a successful result. A non-zero exit code or a timeout is a failed
 * result carrying the process output. Failing to start the process at all raises
 * {@link CommandExecutionException}.
 */
public final class RunOperationCommandExecutor implements CommandExecutor {
  private static final Logger logger = Logger.getLogger(RunOperationCommandExecutor.class.getName());

  static final String RUN_OPERATION = "run-operation";
  static final String ARGS_OPTION = "--args";

  private final String binary;
  private final File projectDir;
  private final String profilesDir;
  private final String target;
  private final Duration timeout;
  private final ProcessRunner processRunner;

  private RunOperationCommandExecutor(Builder builder) {
    this.binary = Objects.requireNonNull(builder.binary, "binary");
    this.projectDir = builder.projectDir;
    this.profilesDir = builder.profilesDir;
    this.target = builder.target;
    this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
    this.processRunner = builder.processRunner != null ? builder.processRunner : ProcessRunner.system();
    if (binary.isBlank()) {
      throw new IllegalArgumentException("binary must not be blank");
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public CommandResult execute(String operationName, String payloadJson) {
    List<String> command = command(operationName, payloadJson);
    ProcessRunner.ProcessResult result;
    try {
      result = processRunner.run(command, projectDir, timeout);
    } catch (IOException e) {
      throw new CommandExecutionException(operationName, "Failed to run " + binary + " " + RUN_OPERATION, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CommandExecutionException(operationName, "Interrupted while running " + operationName, e);
    }

    if (result.timedOut()) {
      logger.warning(operationName + " timed out after " + timeout);
      return CommandResult.failure(result.output());
    }
    if (result.exitCode() != 0) {
      logger.warning(operationName + " exited with code " + result.exitCode());
      return CommandResult.failure(result.output());
    }
    return CommandResult.success(result.output());
  }

  List<String> command(String operationName, String payloadJson) {
    List<String> command = new ArrayList<>();
    command.add(binary);
    command.add(RUN_OPERATION);
    command.add(operationName);
    command.add(ARGS_OPTION);
    command.add(payloadJson);
    if (projectDir != null) {
      command.add("--project-dir");
      command.add(projectDir.getPath());
    }
    if (profilesDir != null) {
      command.add("--profiles-dir");
      command.add(profilesDir);
    }
    if (target != null) {
      command.add("--target");
      command.add(target);
    }
    return command;
  }

  /** Builder for {@link RunOperationCommandExecutor}. */
  public static final class Builder {
    private String binary = "dbt";
    private File projectDir;
    private String profilesDir;
    private String target;
    private Duration timeout = Duration.ofMinutes(10);
    private ProcessRunner processRunner;

    private Builder() {}

    /**
     * Sets the executable to invoke. Optional. Defaults to {@code dbt}.
     */
    public Builder binary(String binary) {
      this.binary = binary;
      return this;
    }

    /**
     * Sets the project directory; also used as the working directory of the process.
     */
    public Builder projectDir(File projectDir) {
      this.projectDir = projectDir;
      return this;
    }

    public Builder profilesDir(String profilesDir) {
      this.profilesDir = profilesDir;
      return this;
    }

    public Builder target(String target) {
      this.target = target;
      return this;
    }

    /**
     * Sets the per-call timeout. Optional. Defaults to 10 minutes.
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Replaces the process launcher. Optional. Defaults to {@link ProcessRunner#system()}.
     */
    public Builder processRunner(ProcessRunner processRunner) {
      this.processRunner = processRunner;
      return this;
    }

    public RunOperationCommandExecutor build() {
      return new RunOperationCommandExecutor(this);
    }
  }
}
