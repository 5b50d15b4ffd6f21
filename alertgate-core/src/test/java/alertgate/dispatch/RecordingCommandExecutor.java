package alertgate.dispatch;

import alertgate.spi.CommandExecutor;
import alertgate.spi.CommandResult;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * CommandExecutor stub that records every call and fails the calls whose zero-based
 * position is listed in {@code failingCalls}.
 */
public class RecordingCommandExecutor implements CommandExecutor {
  public final List<Call> calls = new CopyOnWriteArrayList<>();
  private final Set<Integer> failingCalls;
  private final boolean throwOnFailure;

  public RecordingCommandExecutor() {
    this(Set.of(), false);
  }

  public RecordingCommandExecutor(Set<Integer> failingCalls, boolean throwOnFailure) {
    this.failingCalls = failingCalls;
    this.throwOnFailure = throwOnFailure;
  }

  @Override
  public synchronized CommandResult execute(String operationName, String payloadJson) {
    int position = calls.size();
    calls.add(new Call(operationName, payloadJson));
    if (failingCalls.contains(position)) {
      if (throwOnFailure) {
        throw new IllegalStateException("simulated failure #" + position);
      }
      return CommandResult.failure("failed #" + position);
    }
    return CommandResult.success("ok #" + position);
  }

  public record Call(String operationName, String payloadJson) {}
}
