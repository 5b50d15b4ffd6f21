package alertgate.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * H2 fixture with the two alert tables.
 */
final class AlertTables {

    static JdbcDataSource createDataSource() throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        try (Connection conn = dataSource.getConnection()) {
            for (String table : new String[] {"alerts", "alerts_models"}) {
                conn.createStatement().execute(
                        "CREATE TABLE " + table + " (" +
                                "alert_id VARCHAR(64) PRIMARY KEY," +
                                "alert_class_id VARCHAR(256)," +
                                "detected_at TIMESTAMP," +
                                "status VARCHAR(16) NOT NULL," +
                                "sent_at TIMESTAMP," +
                                "suppression_interval INT" +
                                ")");
            }
        }
        return dataSource;
    }

    static void insert(JdbcDataSource dataSource, String table, String alertId, String classId,
                       Instant detectedAt, String status, Instant sentAt, Integer intervalHours)
            throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("INSERT INTO " + table +
                     " (alert_id, alert_class_id, detected_at, status, sent_at, suppression_interval)" +
                     " VALUES (?,?,?,?,?,?)")) {
            ps.setString(1, alertId);
            ps.setString(2, classId);
            ps.setTimestamp(3, detectedAt == null ? null : Timestamp.from(detectedAt));
            ps.setString(4, status);
            ps.setTimestamp(5, sentAt == null ? null : Timestamp.from(sentAt));
            ps.setObject(6, intervalHours);
            ps.executeUpdate();
        }
    }

    static String status(JdbcDataSource dataSource, String table, String alertId) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT status FROM " + table + " WHERE alert_id = ?")) {
            ps.setString(1, alertId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    static Instant sentAt(JdbcDataSource dataSource, String table, String alertId) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT sent_at FROM " + table + " WHERE alert_id = ?")) {
            ps.setString(1, alertId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getTimestamp(1) == null) {
                    return null;
                }
                return rs.getTimestamp(1).toInstant();
            }
        }
    }

    private AlertTables() {}
}
