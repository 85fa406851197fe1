package io.deskrelay.jdbc.store;

import io.deskrelay.event.NewTicketEvent;
import io.deskrelay.event.TicketEvent;
import io.deskrelay.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL event log store.
 *
 * <p>Appends with {@code INSERT ... RETURNING} in a single round trip.
 */
public final class PostgresTicketEventStore extends AbstractJdbcTicketEventStore {

  public PostgresTicketEventStore() {
    super();
  }

  public PostgresTicketEventStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcTicketEventStore withTableName(String tableName) {
    return new PostgresTicketEventStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public TicketEvent append(Connection conn, NewTicketEvent event) {
    String sql = "INSERT INTO " + tableName() +
        " (ticket_id, event_type, payload, actor_id, created_at) VALUES (?,?,?,?,?)" +
        " RETURNING id";
    long id = JdbcTemplate.insertReturning(conn, sql, rs -> rs.getLong(1),
        event.ticketId(), event.type().name(), event.payloadJson(),
        event.actorId(), JdbcTemplate.timestamp(event.createdAt()));
    return event.withId(id);
  }
}
