package io.deskrelay.spi;

import io.deskrelay.ticket.Comment;

import java.sql.Connection;
import java.util.List;

public interface CommentStore {

    /**
     * Inserts a comment and returns it with its generated id.
     */
    Comment insert(Connection conn, Comment comment);

    /**
     * Returns comments of one ticket, oldest first.
     */
    List<Comment> listByTicket(Connection conn, long ticketId);
}
