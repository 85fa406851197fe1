package io.deskrelay.jdbc.store;

import java.util.List;

/**
 * H2 event log store. Primarily for testing.
 *
 * <p>Uses the generated-keys insert from {@link AbstractJdbcTicketEventStore}.
 */
public final class H2TicketEventStore extends AbstractJdbcTicketEventStore {

  public H2TicketEventStore() {
    super();
  }

  public H2TicketEventStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcTicketEventStore withTableName(String tableName) {
    return new H2TicketEventStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
