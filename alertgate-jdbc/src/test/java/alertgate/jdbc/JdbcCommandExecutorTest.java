package alertgate.jdbc;

import alertgate.spi.CommandResult;
import alertgate.util.JsonCodec;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcCommandExecutorTest {

    private static final Instant T0 = Instant.parse("2022-06-01T10:00:00Z");
    private static final Instant NOW = Instant.parse("2022-06-01T12:00:00Z");

    private JdbcDataSource dataSource;
    private JdbcCommandExecutor executor;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = AlertTables.createDataSource();
        executor = new JdbcCommandExecutor(new DataSourceConnectionProvider(dataSource),
                JsonCodec.getDefault(), Clock.fixed(NOW, ZoneOffset.UTC));
        AlertTables.insert(dataSource, "alerts", "a1", "k1", T0, "pending", null, null);
        AlertTables.insert(dataSource, "alerts", "a2", "k2", T0, "pending", null, null);
        AlertTables.insert(dataSource, "alerts", "a3", "k3", T0, "pending", null, null);
    }

    @Test
    void updateSentAlertsMarksRowsSent() throws SQLException {
        CommandResult result = executor.execute("update_sent_alerts",
                "{\"alert_ids\":[\"a1\",\"a2\"],\"table_name\":\"alerts\"}");

        assertTrue(result.success());
        assertEquals("2", result.output());
        assertEquals("sent", AlertTables.status(dataSource, "alerts", "a1"));
        assertEquals(NOW, AlertTables.sentAt(dataSource, "alerts", "a2"));
        assertEquals("pending", AlertTables.status(dataSource, "alerts", "a3"));
    }

    @Test
    void updateSkippedAlertsLeavesSentAtEmpty() throws SQLException {
        CommandResult result = executor.execute("update_skipped_alerts",
                "{\"alert_ids\":[\"a3\"],\"table_name\":\"alerts\"}");

        assertTrue(result.success());
        assertEquals("skipped", AlertTables.status(dataSource, "alerts", "a3"));
        assertNull(AlertTables.sentAt(dataSource, "alerts", "a3"));
    }

    @Test
    void onlyPendingRowsChange() throws SQLException {
        executor.execute("update_skipped_alerts", "{\"alert_ids\":[\"a1\"],\"table_name\":\"alerts\"}");

        CommandResult result = executor.execute("update_sent_alerts",
                "{\"alert_ids\":[\"a1\",\"unknown\"],\"table_name\":\"alerts\"}");

        assertTrue(result.success());
        assertEquals("0", result.output());
        assertEquals("skipped", AlertTables.status(dataSource, "alerts", "a1"));
    }

    @Test
    void emptyIdListIsNoOp() {
        CommandResult result = executor.execute("update_sent_alerts", "{\"alert_ids\":[],\"table_name\":\"alerts\"}");

        assertTrue(result.success());
        assertEquals("0", result.output());
    }

    @Test
    void unknownOperationFails() {
        CommandResult result = executor.execute("drop_alerts", "{\"alert_ids\":[\"a1\"],\"table_name\":\"alerts\"}");

        assertFalse(result.success());
        assertTrue(result.output().contains("drop_alerts"));
    }

    @Test
    void malformedPayloadsFail() {
        assertFalse(executor.execute("update_sent_alerts", "not json").success());
        assertFalse(executor.execute("update_sent_alerts", "{\"alert_ids\":[\"a1\"]}").success());
        assertFalse(executor.execute("update_sent_alerts",
                "{\"alert_ids\":\"a1\",\"table_name\":\"alerts\"}").success());
        assertFalse(executor.execute("update_sent_alerts",
                "{\"alert_ids\":[1],\"table_name\":\"alerts\"}").success());
        assertFalse(executor.execute("update_sent_alerts",
                "{\"alert_ids\":[\"a1\"],\"table_name\":\"alerts; DELETE FROM alerts\"}").success());
    }

    @Test
    void markMethodsUpdateDirectly() throws SQLException {
        assertEquals(1, executor.markSent(List.of("a1"), "alerts"));
        assertEquals(2, executor.markSkipped(List.of("a2", "a3"), "alerts"));
        assertEquals(0, executor.markSkipped(List.of(), "alerts"));

        assertEquals("sent", AlertTables.status(dataSource, "alerts", "a1"));
        assertEquals("skipped", AlertTables.status(dataSource, "alerts", "a2"));
        assertThrows(IllegalArgumentException.class, () -> executor.markSent(List.of("a1"), "bad name"));
    }

    @Test
    void missingTableRaisesStoreException() {
        assertThrows(AlertStoreException.class, () -> executor.execute("update_sent_alerts",
                "{\"alert_ids\":[\"a1\"],\"table_name\":\"no_such_table\"}"));
    }
}
