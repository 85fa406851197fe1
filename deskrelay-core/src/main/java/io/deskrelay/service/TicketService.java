package io.deskrelay.service;

import io.deskrelay.AccessDeniedException;
import io.deskrelay.TicketEventWriter;
import io.deskrelay.catchup.CatchUpReader;
import io.deskrelay.catchup.EventPage;
import io.deskrelay.event.EventType;
import io.deskrelay.event.NewTicketEvent;
import io.deskrelay.spi.Authorizer;
import io.deskrelay.spi.Notification;
import io.deskrelay.spi.Notifier;
import io.deskrelay.spi.TicketStore;
import io.deskrelay.spi.TransactionRunner;
import io.deskrelay.ticket.NewTicket;
import io.deskrelay.ticket.Ticket;
import io.deskrelay.ticket.TicketNotFoundException;
import io.deskrelay.ticket.TicketSnapshot;
import io.deskrelay.ticket.TicketStatus;
import io.deskrelay.ticket.TicketValidationException;
import io.deskrelay.util.JsonCodec;

import java.sql.Connection;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Ticket operations: every mutation persists the ticket row and appends its event
 * in one transaction.
 *
 * <p>Each mutation checks the actor's permission first, then locks the ticket row,
 * applies the domain transition, writes the row and appends a snapshot event. A
 * rejected transition throws before anything is written, so no event is appended.
 * Committed events reach live subscribers through the writer's hook.
 *
 * <p>Create instances via {@link #builder()}. Thread-safe.
 *
 * @see CommentService
 */
public final class TicketService implements AutoCloseable {

    private final TransactionRunner transactionRunner;
    private final TicketStore ticketStore;
    private final TicketEventWriter eventWriter;
    private final CatchUpReader catchUpReader;
    private final Authorizer authorizer;
    private final JsonCodec jsonCodec;
    private final Clock clock;
    private final NotificationDispatcher notifications;

    private TicketService(Builder builder) {
        this.transactionRunner = Objects.requireNonNull(builder.transactionRunner, "transactionRunner");
        this.ticketStore = Objects.requireNonNull(builder.ticketStore, "ticketStore");
        this.eventWriter = Objects.requireNonNull(builder.eventWriter, "eventWriter");
        this.catchUpReader = Objects.requireNonNull(builder.catchUpReader, "catchUpReader");
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
     * Files a new ticket and appends {@code TICKET_CREATED}.
     *
     * @param actorId the user filing the ticket, usually the requester
     * @param input   ticket fields
     * @return the stored ticket, status {@link TicketStatus#OPEN}
     * @throws AccessDeniedException     without {@code tickets:create}
     * @throws TicketValidationException listing every invalid field
     */
    public Ticket create(UUID actorId, NewTicket input) {
        requirePermission(actorId, Permissions.TICKETS_CREATE);
        Ticket opened = Ticket.open(input, clock.instant());
        return transactionRunner.inTransaction(conn -> {
            Ticket stored = ticketStore.insert(conn, opened);
            appendSnapshot(stored, EventType.TICKET_CREATED, actorId);
            return stored;
        });
    }

    /**
     * Moves a ticket to a new status and appends {@code STATUS_UPDATED}.
     *
     * @throws AccessDeniedException                                  without {@code tickets:update:status}
     * @throws TicketNotFoundException                                if the ticket does not exist
     * @throws io.deskrelay.ticket.InvalidStateTransitionException if the lifecycle forbids it
     */
    public Ticket updateStatus(UUID actorId, long ticketId, TicketStatus status) {
        Objects.requireNonNull(status, "status");
        requirePermission(actorId, Permissions.TICKETS_UPDATE_STATUS);
        Ticket updated = transactionRunner.inTransaction(conn -> {
            Ticket ticket = lockTicket(conn, ticketId);
            ticket.updateStatus(status, clock.instant());
            ticketStore.update(conn, ticket);
            appendSnapshot(ticket, EventType.STATUS_UPDATED, actorId);
            return ticket;
        });
        if (!actorId.equals(updated.requesterId())) {
            notifications.submit(new Notification(updated.requesterId(), updated.id(),
                    "Ticket #" + updated.id() + " status changed",
                    "Your ticket \"" + updated.title() + "\" is now " + updated.status() + "."));
        }
        return updated;
    }

    /**
     * Parses a wire status value and delegates to {@link #updateStatus(UUID, long, TicketStatus)}.
     *
     * @throws TicketValidationException if the value names no status
     */
    public Ticket updateStatus(UUID actorId, long ticketId, String status) {
        TicketStatus parsed;
        try {
            parsed = TicketStatus.parse(status);
        } catch (IllegalArgumentException e) {
            throw new TicketValidationException("status", "status must be one of OPEN, IN_PROGRESS, CLOSED");
        }
        return updateStatus(actorId, ticketId, parsed);
    }

    /**
     * Assigns a ticket and appends {@code TICKET_ASSIGNED}. The status is unchanged.
     *
     * @throws AccessDeniedException                         without {@code tickets:assign}
     * @throws TicketNotFoundException                       if the ticket does not exist
     * @throws io.deskrelay.ticket.ClosedTicketException if the ticket is closed
     */
    public Ticket assign(UUID actorId, long ticketId, UUID assigneeId) {
        if (assigneeId == null) {
            throw new TicketValidationException("assigneeId", "assigneeId is required");
        }
        requirePermission(actorId, Permissions.TICKETS_ASSIGN);
        return transactionRunner.inTransaction(conn -> {
            Ticket ticket = lockTicket(conn, ticketId);
            ticket.assign(assigneeId, clock.instant());
            ticketStore.update(conn, ticket);
            appendSnapshot(ticket, EventType.TICKET_ASSIGNED, actorId);
            return ticket;
        });
    }

    /**
     * Loads a ticket the viewer may see: their own, one assigned to them, or any
     * ticket with {@code tickets:read:all}.
     *
     * @throws AccessDeniedException   without the required permissions
     * @throws TicketNotFoundException if the ticket does not exist
     */
    public Ticket get(UUID viewerId, long ticketId) {
        requirePermission(viewerId, Permissions.TICKETS_READ);
        Ticket ticket = transactionRunner.inTransaction(conn -> ticketStore.findById(conn, ticketId)
                .orElseThrow(() -> new TicketNotFoundException(ticketId)));
        if (!ticket.isParticipant(viewerId)) {
            requirePermission(viewerId, Permissions.TICKETS_READ_ALL);
        }
        return ticket;
    }

    /**
     * Catch-up read of a ticket's events after {@code afterId}, with the same access
     * rules as {@link #get}.
     *
     * @param limit requested page size; clamped by the {@link CatchUpReader}
     */
    public EventPage readEvents(UUID viewerId, long ticketId, long afterId, int limit) {
        get(viewerId, ticketId);
        return catchUpReader.read(ticketId, afterId, limit);
    }

    /**
     * Locks the ticket row for the rest of {@code conn}'s transaction, then applies the
     * {@link #get} access rules. Mutations that append events for a ticket take this lock
     * first, so event ids on one ticket commit in id order.
     */
    Ticket lockVisible(Connection conn, UUID viewerId, long ticketId) {
        requirePermission(viewerId, Permissions.TICKETS_READ);
        Ticket ticket = lockTicket(conn, ticketId);
        if (!ticket.isParticipant(viewerId)) {
            requirePermission(viewerId, Permissions.TICKETS_READ_ALL);
        }
        return ticket;
    }

    private Ticket lockTicket(Connection conn, long ticketId) {
        return ticketStore.findByIdForUpdate(conn, ticketId)
                .orElseThrow(() -> new TicketNotFoundException(ticketId));
    }

    private void appendSnapshot(Ticket ticket, EventType type, UUID actorId) {
        String payload = jsonCodec.toJson(TicketSnapshot.of(ticket));
        eventWriter.append(new NewTicketEvent(ticket.id(), type, payload, actorId, clock.instant()));
    }

    private void requirePermission(UUID actorId, String permission) {
        Objects.requireNonNull(actorId, "actorId");
        if (!authorizer.can(actorId, permission)) {
            throw new AccessDeniedException(actorId, permission);
        }
    }

    /**
     * Waits briefly for pending notifications, then stops the notifier thread.
     */
    @Override
    public void close() {
        notifications.close();
    }

    /** Builder for {@link TicketService}. */
    public static final class Builder {
        private TransactionRunner transactionRunner;
        private TicketStore ticketStore;
        private TicketEventWriter eventWriter;
        private CatchUpReader catchUpReader;
        private Authorizer authorizer;
        private Notifier notifier;
        private JsonCodec jsonCodec;
        private Clock clock;

        private Builder() {
        }

        /**
         * <b>Required.</b> Runs each mutation as one transaction.
         */
        public Builder transactionRunner(TransactionRunner transactionRunner) {
            this.transactionRunner = transactionRunner;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder ticketStore(TicketStore ticketStore) {
            this.ticketStore = ticketStore;
            return this;
        }

        /**
         * <b>Required.</b> Must share its {@code TxContext} with the transaction runner.
         */
        public Builder eventWriter(TicketEventWriter eventWriter) {
            this.eventWriter = eventWriter;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder catchUpReader(CatchUpReader catchUpReader) {
            this.catchUpReader = catchUpReader;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder authorizer(Authorizer authorizer) {
            this.authorizer = authorizer;
            return this;
        }

        /**
         * Optional. Defaults to {@link Notifier#NOOP}.
         */
        public Builder notifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        /**
         * Optional. Defaults to {@link JsonCodec#getDefault()}.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TicketService build() {
            return new TicketService(this);
        }
    }
}
