package io.deskrelay.jdbc.store;

import io.deskrelay.event.EventType;
import io.deskrelay.event.NewTicketEvent;
import io.deskrelay.event.TicketEvent;
import io.deskrelay.jdbc.JdbcTemplate;
import io.deskrelay.jdbc.TableNames;
import io.deskrelay.spi.TicketEventStore;

import java.sql.Connection;
import java.util.List;
import java.util.UUID;

/**
 * Base JDBC event log store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #append} where the database offers a cheaper way to
 * return the generated id. Register custom implementations via
 * {@code META-INF/services/io.deskrelay.jdbc.store.AbstractJdbcTicketEventStore}.
 *
 * @see JdbcTicketEventStores
 */
public abstract class AbstractJdbcTicketEventStore implements TicketEventStore {

  protected static final String COLUMNS = "id, ticket_id, event_type, payload, actor_id, created_at";

  protected static final JdbcTemplate.RowMapper<TicketEvent> EVENT_ROW_MAPPER = rs -> new TicketEvent(
      rs.getLong("id"),
      rs.getLong("ticket_id"),
      EventType.valueOf(rs.getString("event_type")),
      rs.getString("payload"),
      rs.getObject("actor_id", UUID.class),
      JdbcTemplate.instant(rs, "created_at"));

  private final String tableName;

  protected AbstractJdbcTicketEventStore() {
    this(TableNames.DEFAULT_EVENT_TABLE);
  }

  protected AbstractJdbcTicketEventStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect writing to another table.
   */
  public abstract AbstractJdbcTicketEventStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  @Override
  public TicketEvent append(Connection conn, NewTicketEvent event) {
    String sql = "INSERT INTO " + tableName() +
        " (ticket_id, event_type, payload, actor_id, created_at) VALUES (?,?,?,?,?)";
    long id = JdbcTemplate.insertReturningKey(conn, sql,
        event.ticketId(), event.type().name(), event.payloadJson(),
        event.actorId(), JdbcTemplate.timestamp(event.createdAt()));
    return event.withId(id);
  }

  @Override
  public List<TicketEvent> listByTicket(Connection conn, long ticketId, long afterId, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE ticket_id = ? AND id > ? ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, ticketId, afterId, limit);
  }

  @Override
  public long countByTicket(Connection conn, long ticketId) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE ticket_id = ?";
    return JdbcTemplate.query(conn, sql, rs -> rs.getLong(1), ticketId).get(0);
  }
}
