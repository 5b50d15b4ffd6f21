package alertgate.jdbc;

import alertgate.model.AlertStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statement helpers shared by {@link JdbcAlertQueries} and {@link JdbcCommandExecutor}.
 *
 * <p>Parameters are bound by type: an {@link AlertStatus} is written as its stored code and an
 * {@link Instant} as a {@link Timestamp}. A {@link SQLException} surfaces as
 * {@link AlertStoreException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Consumes one row without producing a value. */
  @FunctionalInterface
  public interface RowCallback {
    void accept(ResultSet rs) throws SQLException;
  }

  /** Runs an UPDATE and returns the number of rows changed. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new AlertStoreException("Failed to update alert rows", e);
    }
  }

  /** Runs a SELECT and maps every row. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> results = new ArrayList<>();
    forEach(conn, sql, rs -> results.add(mapper.map(rs)), params);
    return results;
  }

  /**
   * Runs a SELECT and hands each row to {@code callback}.
   *
   * @return number of rows read
   */
  public static int forEach(Connection conn, String sql, RowCallback callback, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        int rows = 0;
        while (rs.next()) {
          callback.accept(rs);
          rows++;
        }
        return rows;
      }
    } catch (SQLException e) {
      throw new AlertStoreException("Failed to read alert rows", e);
    }
  }

  /** Reads a nullable timestamp column. */
  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  /** Returns {@code ?,?,...} with {@code count} placeholders for an alert id IN list. */
  public static String placeholders(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be > 0");
    }
    return String.join(",", Collections.nCopies(count, "?"));
  }

  static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      int index = i + 1;
      if (param == null) {
        ps.setNull(index, Types.NULL);
      } else if (param instanceof AlertStatus status) {
        ps.setString(index, status.value());
      } else if (param instanceof String s) {
        ps.setString(index, s);
      } else if (param instanceof Integer n) {
        ps.setInt(index, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(index, Timestamp.from(instant));
      } else {
        ps.setObject(index, param);
      }
    }
  }

  private JdbcTemplate() {}
}
