package io.deskrelay.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC stores, and the identifier check applied to
 * configurable ones before they are concatenated into SQL.
 */
public final class TableNames {
  public static final String DEFAULT_EVENT_TABLE = "ticket_events";
  public static final String DEFAULT_TICKET_TABLE = "tickets";
  public static final String DEFAULT_COMMENT_TABLE = "ticket_comments";
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
