package io.deskrelay.service;

import io.deskrelay.AccessDeniedException;
import io.deskrelay.TicketEventWriter;
import io.deskrelay.event.EventType;
import io.deskrelay.event.NewTicketEvent;
import io.deskrelay.spi.Authorizer;
import io.deskrelay.spi.CommentStore;
import io.deskrelay.spi.Notification;
import io.deskrelay.spi.Notifier;
import io.deskrelay.spi.TransactionRunner;
import io.deskrelay.ticket.Comment;
import io.deskrelay.ticket.CommentSnapshot;
import io.deskrelay.ticket.Ticket;
import io.deskrelay.ticket.TicketNotFoundException;
import io.deskrelay.util.JsonCodec;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Comments on tickets. Posting a comment stores it and appends {@code COMMENT_ADDED}
 * in one transaction.
 *
 * <p>Ticket visibility follows {@link TicketService#get}. Posting holds the ticket
 * row lock, like every other ticket mutation.
 */
public final class CommentService implements AutoCloseable {

    private final TicketService ticketService;
    private final TransactionRunner transactionRunner;
    private final CommentStore commentStore;
    private final TicketEventWriter eventWriter;
    private final Authorizer authorizer;
    private final JsonCodec jsonCodec;
    private final Clock clock;
    private final NotificationDispatcher notifications;

    private CommentService(Builder builder) {
        this.ticketService = Objects.requireNonNull(builder.ticketService, "ticketService");
        this.transactionRunner = Objects.requireNonNull(builder.transactionRunner, "transactionRunner");
        this.commentStore = Objects.requireNonNull(builder.commentStore, "commentStore");
        this.eventWriter = Objects.requireNonNull(builder.eventWriter, "eventWriter");
        this.authorizer = Objects.requireNonNull(builder.authorizer, "authorizer");
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.notifications = new NotificationDispatcher(
                builder.notifier != null ? builder.notifier : Notifier.NOOP);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Posts a comment on a ticket the author can see.
     *
     * @throws AccessDeniedException     without {@code comments:create} or ticket access
     * @throws TicketNotFoundException   if the ticket does not exist
     * @throws io.deskrelay.ticket.TicketValidationException if the body is empty or too long
     */
    public Comment addComment(UUID authorId, long ticketId, String body) {
        requirePermission(authorId, Permissions.COMMENTS_CREATE);
        Posted posted = transactionRunner.inTransaction(conn -> {
            Ticket ticket = ticketService.lockVisible(conn, authorId, ticketId);
            Comment inserted = commentStore.insert(conn,
                    Comment.create(ticketId, authorId, body, clock.instant()));
            String payload = jsonCodec.toJson(CommentSnapshot.of(inserted));
            eventWriter.append(new NewTicketEvent(ticketId, EventType.COMMENT_ADDED, payload, authorId,
                    inserted.createdAt()));
            return new Posted(ticket, inserted);
        });
        Ticket ticket = posted.ticket();
        if (!authorId.equals(ticket.requesterId())) {
            notifications.submit(new Notification(ticket.requesterId(), ticketId,
                    "New comment on ticket #" + ticketId,
                    "A new comment was added to \"" + ticket.title() + "\"."));
        }
        return posted.comment();
    }

    /**
     * Returns a ticket's comments, oldest first.
     *
     * @throws AccessDeniedException   without {@code comments:read} or ticket access
     * @throws TicketNotFoundException if the ticket does not exist
     */
    public List<Comment> listComments(UUID viewerId, long ticketId) {
        requirePermission(viewerId, Permissions.COMMENTS_READ);
        ticketService.get(viewerId, ticketId);
        return transactionRunner.inTransaction(conn -> commentStore.listByTicket(conn, ticketId));
    }

    private record Posted(Ticket ticket, Comment comment) {
    }

    private void requirePermission(UUID actorId, String permission) {
        Objects.requireNonNull(actorId, "actorId");
        if (!authorizer.can(actorId, permission)) {
            throw new AccessDeniedException(actorId, permission);
        }
    }

    @Override
    public void close() {
        notifications.close();
    }

    /** Builder for {@link CommentService}. */
    public static final class Builder {
        private TicketService ticketService;
        private TransactionRunner transactionRunner;
        private CommentStore commentStore;
        private TicketEventWriter eventWriter;
        private Authorizer authorizer;
        private Notifier notifier;
        private JsonCodec jsonCodec;
        private Clock clock;

        private Builder() {
        }

        /** <b>Required.</b> Used for ticket lookup and access checks. */
        public Builder ticketService(TicketService ticketService) {
            this.ticketService = ticketService;
            return this;
        }

        /** <b>Required.</b> */
        public Builder transactionRunner(TransactionRunner transactionRunner) {
            this.transactionRunner = transactionRunner;
            return this;
        }

        /** <b>Required.</b> */
        public Builder commentStore(CommentStore commentStore) {
            this.commentStore = commentStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder eventWriter(TicketEventWriter eventWriter) {
            this.eventWriter = eventWriter;
            return this;
        }

        /** <b>Required.</b> */
        public Builder authorizer(Authorizer authorizer) {
            this.authorizer = authorizer;
            return this;
        }

        /** Optional. Defaults to {@link Notifier#NOOP}. */
        public Builder notifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        /** Optional. Defaults to {@link JsonCodec#getDefault()}. */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /** Optional. Defaults to {@link Clock#systemUTC()}. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CommentService build() {
            return new CommentService(this);
        }
    }
}
