package alertgate.jdbc;

import alertgate.model.AlertKind;

import java.util.Objects;

/**
 * Shared table name validation for the JDBC alert components. Table names are concatenated
 * into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_TEST_TABLE = AlertKind.TEST.defaultTableName();
  public static final String DEFAULT_MODEL_TABLE = AlertKind.MODEL.defaultTableName();
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
