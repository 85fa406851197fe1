package io.deskrelay.jdbc.store;

import io.deskrelay.jdbc.JdbcTemplate;
import io.deskrelay.jdbc.TableNames;
import io.deskrelay.spi.CommentStore;
import io.deskrelay.ticket.Comment;

import java.sql.Connection;
import java.util.List;
import java.util.UUID;

/**
 * {@link CommentStore} over a {@code ticket_comments} table.
 */
public final class JdbcCommentStore implements CommentStore {

  private static final JdbcTemplate.RowMapper<Comment> COMMENT_ROW_MAPPER = rs -> new Comment(
      rs.getLong("id"),
      rs.getLong("ticket_id"),
      rs.getObject("author_id", UUID.class),
      rs.getString("body"),
      JdbcTemplate.instant(rs, "created_at"));

  private final String tableName;

  public JdbcCommentStore() {
    this(TableNames.DEFAULT_COMMENT_TABLE);
  }

  public JdbcCommentStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public Comment insert(Connection conn, Comment comment) {
    String sql = "INSERT INTO " + tableName + " (ticket_id, author_id, body, created_at) VALUES (?,?,?,?)";
    long id = JdbcTemplate.insertReturningKey(conn, sql,
        comment.ticketId(), comment.authorId(), comment.body(), JdbcTemplate.timestamp(comment.createdAt()));
    return comment.withId(id);
  }

  @Override
  public List<Comment> listByTicket(Connection conn, long ticketId) {
    String sql = "SELECT id, ticket_id, author_id, body, created_at FROM " + tableName +
        " WHERE ticket_id=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, COMMENT_ROW_MAPPER, ticketId);
  }
}
