package alertgate.jdbc;

import alertgate.model.Alert;
import alertgate.model.AlertKind;
import alertgate.model.LastSentRecord;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcAlertQueriesTest {

    private static final Instant T0 = Instant.parse("2022-06-01T10:00:00Z");

    private JdbcDataSource dataSource;
    private JdbcAlertQueries queries;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = AlertTables.createDataSource();
        queries = new JdbcAlertQueries(new DataSourceConnectionProvider(dataSource));
    }

    @Test
    void lastSentIsLatestSentAtPerClass() throws SQLException {
        AlertTables.insert(dataSource, "alerts", "s1", "k1", T0, "sent", T0.plusSeconds(10), null);
        AlertTables.insert(dataSource, "alerts", "s2", "k1", T0, "sent", T0.plusSeconds(90), null);
        AlertTables.insert(dataSource, "alerts", "s3", "k2", T0, "sent", T0.plusSeconds(20), null);
        AlertTables.insert(dataSource, "alerts", "p1", "k3", T0, "pending", null, null);
        AlertTables.insert(dataSource, "alerts", "x1", "k3", T0, "skipped", null, null);

        LastSentRecord record = queries.queryLastSentTimes(AlertKind.TEST);

        assertEquals(AlertKind.TEST, record.kind());
        assertEquals(2, record.size());
        assertEquals(T0.plusSeconds(90), record.sentAt("k1").orElseThrow());
        assertEquals(T0.plusSeconds(20), record.sentAt("k2").orElseThrow());
        assertFalse(record.sentAt("k3").isPresent());
    }

    @Test
    void kindsReadTheirOwnTables() throws SQLException {
        AlertTables.insert(dataSource, "alerts_models", "m1", "model.k1", T0, "sent", T0, null);
        AlertTables.insert(dataSource, "alerts_models", "m2", "model.k2", T0, "pending", null, null);

        assertEquals(0, queries.queryLastSentTimes(AlertKind.TEST).size());
        assertTrue(queries.queryPendingAlerts(AlertKind.TEST).isEmpty());
        assertEquals(T0, queries.queryLastSentTimes(AlertKind.MODEL).sentAt("model.k1").orElseThrow());
        List<Alert> pending = queries.queryPendingAlerts(AlertKind.MODEL);
        assertEquals(1, pending.size());
        assertEquals(AlertKind.MODEL, pending.get(0).kind());
    }

    @Test
    void pendingAlertsAreOrderedByDetection() throws SQLException {
        AlertTables.insert(dataSource, "alerts", "late", "k1", T0.plusSeconds(60), "pending", null, 6);
        AlertTables.insert(dataSource, "alerts", "early", "k2", T0, "pending", null, null);
        AlertTables.insert(dataSource, "alerts", "done", "k3", T0, "sent", T0, null);

        List<Alert> pending = queries.queryPendingAlerts(AlertKind.TEST);

        assertEquals(List.of("early", "late"), pending.stream().map(Alert::id).collect(Collectors.toList()));
        Alert late = pending.get(1);
        assertEquals("k1", late.identityKey());
        assertEquals(T0.plusSeconds(60), late.detectedAt());
        assertEquals(Duration.ofHours(6), late.suppressionInterval());
        assertNull(pending.get(0).suppressionInterval());
    }

    @Test
    void pendingAlertWithoutClassIdIsReturned() throws SQLException {
        AlertTables.insert(dataSource, "alerts", "orphan", null, null, "pending", null, null);

        Alert alert = queries.queryPendingAlerts(AlertKind.TEST).get(0);

        assertNull(alert.identityKey());
        assertNull(alert.detectedAt());
        assertFalse(alert.isComplete());
    }

    @Test
    void daysBackLimitsBothQueries() throws SQLException {
        Clock clock = Clock.fixed(T0.plus(Duration.ofDays(10)), ZoneOffset.UTC);
        JdbcAlertQueries recent = JdbcAlertQueries.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .daysBack(7)
                .clock(clock)
                .build();
        AlertTables.insert(dataSource, "alerts", "old-sent", "k1", T0, "sent", T0, null);
        AlertTables.insert(dataSource, "alerts", "old-pending", "k2", T0, "pending", null, null);
        AlertTables.insert(dataSource, "alerts", "new-pending", "k2", T0.plus(Duration.ofDays(9)),
                "pending", null, null);

        assertEquals(0, recent.queryLastSentTimes(AlertKind.TEST).size());
        assertEquals(List.of("new-pending"),
                recent.queryPendingAlerts(AlertKind.TEST).stream().map(Alert::id).collect(Collectors.toList()));
    }

    @Test
    void customTableName() throws SQLException {
        try (var conn = dataSource.getConnection()) {
            conn.createStatement().execute("CREATE TABLE my_alerts AS SELECT * FROM alerts WHERE 1 = 0");
        }
        AlertTables.insert(dataSource, "my_alerts", "c1", "k1", T0, "pending", null, null);
        JdbcAlertQueries custom = JdbcAlertQueries.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .tableName(AlertKind.TEST, "my_alerts")
                .build();

        assertEquals("my_alerts", custom.tableName(AlertKind.TEST));
        assertEquals(1, custom.queryPendingAlerts(AlertKind.TEST).size());
    }

    @Test
    void missingTableRaisesStoreException() throws SQLException {
        try (var conn = dataSource.getConnection()) {
            conn.createStatement().execute("DROP TABLE alerts");
        }

        assertThrows(AlertStoreException.class, () -> queries.queryPendingAlerts(AlertKind.TEST));
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> JdbcAlertQueries.builder().build());
        assertThrows(IllegalArgumentException.class, () -> JdbcAlertQueries.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .tableName(AlertKind.MODEL, "bad-name")
                .build());
        assertThrows(IllegalArgumentException.class, () -> JdbcAlertQueries.builder().daysBack(0));
    }
}
