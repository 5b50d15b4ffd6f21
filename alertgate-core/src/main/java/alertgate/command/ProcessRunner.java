package alertgate.command;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an external command and collects its exit status and combined output.
 *
 * @see #system()
 */
@FunctionalInterface
public interface ProcessRunner {

  /**
   * Runs {@code command} and waits for it to finish.
   *
   * @param command   the program and its arguments
   * @param directory working directory, or {@code null} for the current one
   * @param timeout   maximum time to wait
   * @return exit status and output
   * @throws IOException          if the process cannot be started or its output read
   * @throws InterruptedException if interrupted while waiting
   */
  ProcessResult run(List<String> command, File directory, Duration timeout)
      throws IOException, InterruptedException;

  /**
   * Outcome of a process run.
   *
   * @param exitCode process exit code; meaningless when {@code timedOut}
   * @param output   combined stdout and stderr
   * @param timedOut whether the process was killed after exceeding the timeout
   */
  record ProcessResult(int exitCode, String output, boolean timedOut) {
    public boolean succeeded() {
      return !timedOut && exitCode == 0;
    }
  }

  /**
   * Returns a runner backed by {@link ProcessBuilder}. Output is buffered in a temporary file
   * so a chatty process cannot block on a full pipe.
   */
  static ProcessRunner system() {
    return SystemProcessRunner.INSTANCE;
  }

  final class SystemProcessRunner implements ProcessRunner {
    private static final Logger logger = Logger.getLogger(SystemProcessRunner.class.getName());
    static final SystemProcessRunner INSTANCE = new SystemProcessRunner();

    private SystemProcessRunner() {
    }

    @Override
    public ProcessResult run(List<String> command, File directory, Duration timeout)
        throws IOException, InterruptedException {
      Path outputFile = Files.createTempFile("alertgate-run-operation", ".log");
      try {
        Process process = new ProcessBuilder(command)
            .directory(directory)
            .redirectErrorStream(true)
            .redirectOutput(outputFile.toFile())
            .start();
        boolean finished;
        try {
          finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
          if (!finished) {
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
          }
        } catch (InterruptedException e) {
          // the child must not outlive the interrupted caller
          process.destroyForcibly();
          throw e;
        }
        String output = Files.readString(outputFile, StandardCharsets.UTF_8);
        return new ProcessResult(finished ? process.exitValue() : -1, output, !finished);
      } finally {
        try {
          Files.deleteIfExists(outputFile);
        } catch (IOException e) {
          logger.log(Level.FINE, "Could not delete " + outputFile, e);
        }
      }
    }
  }
}
