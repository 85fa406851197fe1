package io.deskrelay.jdbc.store;

import io.deskrelay.jdbc.JdbcTemplate;
import io.deskrelay.jdbc.TableNames;
import io.deskrelay.spi.TicketStore;
import io.deskrelay.ticket.Ticket;
import io.deskrelay.ticket.TicketNotFoundException;
import io.deskrelay.ticket.TicketPriority;
import io.deskrelay.ticket.TicketStatus;

import java.sql.Connection;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link TicketStore} over a {@code tickets} table. The SQL is portable across H2
 * and PostgreSQL.
 */
public final class JdbcTicketStore implements TicketStore {

  private static final String COLUMNS = "id, title, description, status, priority, requester_id, " +
      "assignee_id, created_at, updated_at, closed_at";

  private static final JdbcTemplate.RowMapper<Ticket> TICKET_ROW_MAPPER = rs -> Ticket.restore(
      rs.getLong("id"),
      rs.getString("title"),
      rs.getString("description"),
      TicketStatus.valueOf(rs.getString("status")),
      TicketPriority.valueOf(rs.getString("priority")),
      rs.getObject("requester_id", UUID.class),
      rs.getObject("assignee_id", UUID.class),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"),
      JdbcTemplate.instant(rs, "closed_at"));

  private final String tableName;

  public JdbcTicketStore() {
    this(TableNames.DEFAULT_TICKET_TABLE);
  }

  public JdbcTicketStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public Ticket insert(Connection conn, Ticket ticket) {
    String sql = "INSERT INTO " + tableName + " (title, description, status, priority, requester_id, " +
        "assignee_id, created_at, updated_at, closed_at) VALUES (?,?,?,?,?,?,?,?,?)";
    long id = JdbcTemplate.insertReturningKey(conn, sql,
        ticket.title(), ticket.description(), ticket.status().name(), ticket.priority().name(),
        ticket.requesterId(), ticket.assigneeId(), JdbcTemplate.timestamp(ticket.createdAt()),
        JdbcTemplate.timestamp(ticket.updatedAt()), JdbcTemplate.timestamp(ticket.closedAt()));
    return ticket.withId(id);
  }

  @Override
  public void update(Connection conn, Ticket ticket) {
    String sql = "UPDATE " + tableName +
        " SET status=?, assignee_id=?, updated_at=?, closed_at=? WHERE id=?";
    int rows = JdbcTemplate.update(conn, sql,
        ticket.status().name(), ticket.assigneeId(),
        JdbcTemplate.timestamp(ticket.updatedAt()), JdbcTemplate.timestamp(ticket.closedAt()),
        ticket.id());
    if (rows == 0) {
      throw new TicketNotFoundException(ticket.id());
    }
  }

  @Override
  public Optional<Ticket> findById(Connection conn, long ticketId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, TICKET_ROW_MAPPER, ticketId);
  }

  @Override
  public Optional<Ticket> findByIdForUpdate(Connection conn, long ticketId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=? FOR UPDATE";
    return JdbcTemplate.queryOne(conn, sql, TICKET_ROW_MAPPER, ticketId);
  }
}
