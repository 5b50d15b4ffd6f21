package alertgate.command;

import alertgate.CommandExecutionException;
import alertgate.spi.CommandResult;
import alertgate.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunOperationCommandExecutorTest {

    private static final String PAYLOAD = "{\"alert_ids\":[\"a1\",\"a2\"],\"table_name\":\"alerts\"}";

    private final List<List<String>> commands = new ArrayList<>();
    private final List<File> directories = new ArrayList<>();

    private ProcessRunner answering(ProcessRunner.ProcessResult result) {
        return (command, directory, timeout) -> {
            commands.add(command);
            directories.add(directory);
            return result;
        };
    }

    // ── Command line ─────────────────────────────────────────────

    @Test
    void buildsRunOperationCommandLine() {
        RunOperationCommandExecutor executor = RunOperationCommandExecutor.builder()
                .processRunner(answering(new ProcessRunner.ProcessResult(0, "done", false)))
                .build();

        CommandResult result = executor.execute("update_sent_alerts", PAYLOAD);

        assertTrue(result.success());
        assertEquals("done", result.output());
        List<String> args = commands.get(0);
        assertEquals("dbt", args.get(0));
        assertEquals("run-operation", args.get(1));
        assertEquals("update_sent_alerts", args.get(2));
        assertEquals("--args", args.get(3));
        Map<String, Object> json = JsonCodec.getDefault().parseObject(args.get(4));
        assertEquals(List.of("a1", "a2"), json.get("alert_ids"));
        assertEquals(5, args.size());
    }

    @Test
    void appendsProjectOptions() {
        File projectDir = new File("/tmp/monitor");
        RunOperationCommandExecutor executor = RunOperationCommandExecutor.builder()
                .binary("/opt/dbt/bin/dbt")
                .projectDir(projectDir)
                .profilesDir("/etc/profiles")
                .target("prod")
                .processRunner(answering(new ProcessRunner.ProcessResult(0, "", false)))
                .build();

        executor.execute("update_skipped_alerts", PAYLOAD);

        assertEquals(List.of("/opt/dbt/bin/dbt", "run-operation", "update_skipped_alerts", "--args", PAYLOAD,
                "--project-dir", projectDir.getPath(), "--profiles-dir", "/etc/profiles", "--target", "prod"),
                commands.get(0));
        assertSame(projectDir, directories.get(0));
    }

    // ── Outcomes ─────────────────────────────────────────────────

    @Test
    void nonZeroExitIsFailureWithOutput() {
        RunOperationCommandExecutor executor = RunOperationCommandExecutor.builder()
                .processRunner(answering(new ProcessRunner.ProcessResult(2, "Compilation Error", false)))
                .build();

        CommandResult result = executor.execute("update_sent_alerts", PAYLOAD);

        assertFalse(result.success());
        assertEquals("Compilation Error", result.output());
    }

    @Test
    void timeoutIsFailure() {
        RunOperationCommandExecutor executor = RunOperationCommandExecutor.builder()
                .processRunner(answering(new ProcessRunner.ProcessResult(-1, "partial", true)))
                .build();

        assertFalse(executor.execute("update_sent_alerts", PAYLOAD).success());
    }

    @Test
    void launchErrorRaisesCommandExecutionException() {
        RunOperationCommandExecutor executor = RunOperationCommandExecutor.builder()
                .processRunner((command, directory, timeout) -> {
                    throw new IOException("No such file: dbt");
                })
                .build();

        CommandExecutionException ex = assertThrows(CommandExecutionException.class,
                () -> executor.execute("update_sent_alerts", PAYLOAD));
        assertEquals("update_sent_alerts", ex.operationName());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void interruptionRestoresFlag() {
        RunOperationCommandExecutor executor = RunOperationCommandExecutor.builder()
                .processRunner((command, directory, timeout) -> {
                    throw new InterruptedException();
                })
                .build();

        try {
            assertThrows(CommandExecutionException.class, () -> executor.execute("update_sent_alerts", PAYLOAD));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    // ── Builder validation ───────────────────────────────────────

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () ->
                RunOperationCommandExecutor.builder().binary(" ").build());
        assertThrows(IllegalArgumentException.class, () ->
                RunOperationCommandExecutor.builder().timeout(Duration.ZERO).build());
        assertThrows(NullPointerException.class, () ->
                RunOperationCommandExecutor.builder().timeout(null).build());
    }
}
