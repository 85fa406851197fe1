package io.deskrelay.jdbc;

import io.deskrelay.AccessDeniedException;
import io.deskrelay.TicketEventWriter;
import io.deskrelay.WriterHook;
import io.deskrelay.catchup.CatchUpReader;
import io.deskrelay.catchup.EventPage;
import io.deskrelay.event.EventType;
import io.deskrelay.event.TicketEvent;
import io.deskrelay.jdbc.store.H2TicketEventStore;
import io.deskrelay.jdbc.store.JdbcCommentStore;
import io.deskrelay.jdbc.store.JdbcTicketStore;
import io.deskrelay.jdbc.tx.JdbcTransactionManager;
import io.deskrelay.jdbc.tx.ThreadLocalTxContext;
import io.deskrelay.service.CommentService;
import io.deskrelay.service.Permissions;
import io.deskrelay.service.TicketService;
import io.deskrelay.spi.Authorizer;
import io.deskrelay.spi.Notification;
import io.deskrelay.ticket.ClosedTicketException;
import io.deskrelay.ticket.Comment;
import io.deskrelay.ticket.InvalidStateTransitionException;
import io.deskrelay.ticket.NewTicket;
import io.deskrelay.ticket.Ticket;
import io.deskrelay.ticket.TicketNotFoundException;
import io.deskrelay.ticket.TicketPriority;
import io.deskrelay.ticket.TicketStatus;
import io.deskrelay.ticket.TicketValidationException;
import io.deskrelay.util.JsonCodec;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Ticket and comment services against H2, from mutation to event log to catch-up.
 */
class TicketWorkflowIntegrationTest {

    private static final UUID REQUESTER = UUID.randomUUID();
    private static final UUID AGENT = UUID.randomUUID();
    private static final UUID STRANGER = UUID.randomUUID();

    private static final Set<String> REQUESTER_PERMISSIONS = Set.of(
            Permissions.TICKETS_CREATE, Permissions.TICKETS_READ,
            Permissions.COMMENTS_CREATE, Permissions.COMMENTS_READ);
    private static final Set<String> AGENT_PERMISSIONS = Set.of(
            Permissions.TICKETS_CREATE, Permissions.TICKETS_READ, Permissions.TICKETS_READ_ALL,
            Permissions.TICKETS_UPDATE_STATUS, Permissions.TICKETS_ASSIGN,
            Permissions.COMMENTS_CREATE, Permissions.COMMENTS_READ);

    private final Map<UUID, Set<String>> grants = Map.of(
            REQUESTER, REQUESTER_PERMISSIONS,
            AGENT, AGENT_PERMISSIONS,
            STRANGER, REQUESTER_PERMISSIONS);
    private final Authorizer authorizer = (actor, permission) ->
            grants.getOrDefault(actor, Set.of()).contains(permission);

    private final List<TicketEvent> broadcast = new CopyOnWriteArrayList<>();
    private final List<Notification> notifications = new CopyOnWriteArrayList<>();
    private volatile Consumer<TicketEvent> onAppend = event -> { };

    private JdbcDataSource dataSource;
    private CatchUpReader reader;
    private H2TicketEventStore eventStore;
    private TicketService tickets;
    private CommentService comments;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestSchemas.freshH2();
        eventStore = new H2TicketEventStore();
        ThreadLocalTxContext txContext = new ThreadLocalTxContext();
        DataSourceConnectionProvider connections = new DataSourceConnectionProvider(dataSource);
        JdbcTransactionManager txManager = new JdbcTransactionManager(connections, txContext);
        WriterHook hook = new WriterHook() {
            @Override
            public void afterAppend(TicketEvent event) {
                onAppend.accept(event);
            }

            @Override
            public void afterCommit(TicketEvent event) {
                broadcast.add(event);
            }
        };
        TicketEventWriter writer = new TicketEventWriter(txContext, eventStore, hook, null);
        reader = new CatchUpReader(connections, eventStore);

        tickets = TicketService.builder()
                .transactionRunner(txManager)
                .ticketStore(new JdbcTicketStore())
                .eventWriter(writer)
                .catchUpReader(reader)
                .authorizer(authorizer)
                .notifier(notifications::add)
                .build();
        comments = CommentService.builder()
                .ticketService(tickets)
                .transactionRunner(txManager)
                .commentStore(new JdbcCommentStore())
                .eventWriter(writer)
                .authorizer(authorizer)
                .notifier(notifications::add)
                .build();
    }

    @AfterEach
    void tearDown() {
        comments.close();
        tickets.close();
    }

    // ── Lifecycle ────────────────────────────────────────────────

    @Test
    void printerDownLifecycle() throws Exception {
        Ticket created = tickets.create(REQUESTER,
                NewTicket.of("Printer down", "Floor 3 printer jams", TicketPriority.HIGH, REQUESTER));
        long ticketId = created.id();

        assertEquals(TicketStatus.OPEN, created.status());
        assertEquals(1, countEvents(ticketId));
        TicketEvent createdEvent = singleEvent(ticketId, 0);
        assertEquals(EventType.TICKET_CREATED, createdEvent.type());
        assertEquals(REQUESTER, createdEvent.actorId());

        Ticket assigned = tickets.assign(AGENT, ticketId, AGENT);
        assertEquals(TicketStatus.OPEN, assigned.status());
        assertEquals(AGENT, assigned.assigneeId());
        TicketEvent assignedEvent = singleEvent(ticketId, createdEvent.id());
        assertEquals(EventType.TICKET_ASSIGNED, assignedEvent.type());
        assertTrue(assignedEvent.id() > createdEvent.id());

        tickets.updateStatus(AGENT, ticketId, TicketStatus.IN_PROGRESS);
        Ticket closed = tickets.updateStatus(AGENT, ticketId, TicketStatus.CLOSED);
        assertEquals(TicketStatus.CLOSED, closed.status());
        assertNotNull(closed.closedAt());
        assertEquals(4, countEvents(ticketId));

        assertThrows(InvalidStateTransitionException.class,
                () -> tickets.updateStatus(AGENT, ticketId, TicketStatus.OPEN));
        assertEquals(4, countEvents(ticketId));

        assertEquals(List.of(EventType.TICKET_CREATED, EventType.TICKET_ASSIGNED,
                        EventType.STATUS_UPDATED, EventType.STATUS_UPDATED),
                broadcast.stream().map(TicketEvent::type).toList());
    }

    @Test
    void snapshotPayloadDescribesResultingState() throws Exception {
        Ticket created = tickets.create(REQUESTER,
                NewTicket.of("VPN", "Cannot connect", TicketPriority.MEDIUM, REQUESTER));
        tickets.updateStatus(AGENT, created.id(), "IN_PROGRESS");

        EventPage page = tickets.readEvents(AGENT, created.id(), 0, 10);
        Map<?, ?> snapshot = JsonCodec.getDefault().fromJson(page.events().get(1).payloadJson(), Map.class);

        assertEquals("IN_PROGRESS", snapshot.get("status"));
        assertEquals("MEDIUM", snapshot.get("priority"));
        assertEquals(REQUESTER.toString(), snapshot.get("requesterId"));
        assertNull(snapshot.get("closedAt"));
    }

    @Test
    void assigningClosedTicketAppendsNothing() throws Exception {
        long ticketId = openTicket();
        tickets.updateStatus(AGENT, ticketId, TicketStatus.CLOSED);
        long before = countEvents(ticketId);

        assertThrows(ClosedTicketException.class, () -> tickets.assign(AGENT, ticketId, AGENT));

        assertEquals(before, countEvents(ticketId));
        assertNull(tickets.get(AGENT, ticketId).assigneeId());
    }

    @Test
    void invalidInputWritesNothing() throws Exception {
        assertThrows(TicketValidationException.class, () ->
                tickets.create(REQUESTER, new NewTicket(" ", "desc", "URGENT", REQUESTER)));
        long ticketId = openTicket();

        assertThrows(TicketValidationException.class, () -> tickets.updateStatus(AGENT, ticketId, "DONE"));
        assertThrows(TicketValidationException.class, () -> tickets.assign(AGENT, ticketId, null));
        assertEquals(1, countEvents(ticketId));
    }

    @Test
    void missingTicket() {
        assertThrows(TicketNotFoundException.class, () -> tickets.updateStatus(AGENT, 999, TicketStatus.CLOSED));
        assertThrows(TicketNotFoundException.class, () -> tickets.get(AGENT, 999));
        assertTrue(broadcast.isEmpty());
    }

    // ── Access ──────────────────────────────────────────────────

    @Test
    void permissionsAreCheckedBeforeWriting() throws Exception {
        long ticketId = openTicket();

        assertThrows(AccessDeniedException.class, () -> tickets.updateStatus(REQUESTER, ticketId, TicketStatus.CLOSED));
        assertThrows(AccessDeniedException.class, () -> tickets.assign(REQUESTER, ticketId, AGENT));
        assertEquals(1, countEvents(ticketId));
    }

    @Test
    void onlyParticipantsOrReadAllMayView() throws Exception {
        long ticketId = openTicket();

        assertEquals(ticketId, tickets.get(REQUESTER, ticketId).id());
        assertEquals(ticketId, tickets.get(AGENT, ticketId).id());
        AccessDeniedException denied = assertThrows(AccessDeniedException.class, () -> tickets.get(STRANGER, ticketId));
        assertEquals(Permissions.TICKETS_READ_ALL, denied.permission());
        assertThrows(AccessDeniedException.class, () -> tickets.readEvents(STRANGER, ticketId, 0, 10));
        assertThrows(AccessDeniedException.class, () -> comments.addComment(STRANGER, ticketId, "hi"));
    }

    // ── Comments and catch-up ───────────────────────────────────

    @Test
    void commentsAppendEventsAndCatchUpPagesThroughThem() throws Exception {
        long ticketId = openTicket();
        Comment first = comments.addComment(AGENT, ticketId, "On my way");
        comments.addComment(REQUESTER, ticketId, "Thanks");
        comments.addComment(AGENT, ticketId, "Fixed");

        assertEquals(List.of("On my way", "Thanks", "Fixed"),
                comments.listComments(REQUESTER, ticketId).stream().map(Comment::body).toList());
        assertTrue(first.id() > 0);

        EventPage firstPage = tickets.readEvents(REQUESTER, ticketId, 0, 2);
        assertEquals(2, firstPage.events().size());
        EventPage secondPage = tickets.readEvents(REQUESTER, ticketId, firstPage.nextCursor().getAsLong(), 2);
        assertEquals(List.of(EventType.COMMENT_ADDED, EventType.COMMENT_ADDED),
                secondPage.events().stream().map(TicketEvent::type).toList());
        EventPage end = tickets.readEvents(REQUESTER, ticketId, secondPage.nextCursor().getAsLong(), 2);
        assertTrue(end.isEmpty());
        assertFalse(end.nextCursor().isPresent());
    }

    @Test
    void concurrentMutationsCommitInEventIdOrder() throws Exception {
        long ticketId = openTicket();
        CountDownLatch commentAppended = new CountDownLatch(1);
        CountDownLatch releaseComment = new CountDownLatch(1);
        onAppend = event -> {
            if (event.type() == EventType.COMMENT_ADDED) {
                commentAppended.countDown();
                try {
                    releaseComment.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Comment> comment = pool.submit(() -> comments.addComment(REQUESTER, ticketId, "Any update?"));
            assertTrue(commentAppended.await(5, TimeUnit.SECONDS));
            Future<Ticket> status = pool.submit(() -> tickets.updateStatus(AGENT, ticketId, TicketStatus.IN_PROGRESS));
            Thread.sleep(200);

            // The status change waits on the comment's row lock, so nothing past the
            // uncommitted comment event is visible yet.
            EventPage first = reader.read(ticketId, 0, 50);
            assertEquals(List.of(EventType.TICKET_CREATED),
                    first.events().stream().map(TicketEvent::type).toList());
            assertFalse(status.isDone());

            releaseComment.countDown();
            comment.get(5, TimeUnit.SECONDS);
            status.get(5, TimeUnit.SECONDS);

            EventPage rest = reader.read(ticketId, first.nextCursor().getAsLong(), 50);
            assertEquals(List.of(EventType.COMMENT_ADDED, EventType.STATUS_UPDATED),
                    rest.events().stream().map(TicketEvent::type).toList());
            assertEquals(3, countEvents(ticketId));
        } finally {
            releaseComment.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void requesterIsNotifiedOfOtherPeoplesChanges() throws Exception {
        long ticketId = openTicket();
        tickets.updateStatus(AGENT, ticketId, TicketStatus.IN_PROGRESS);
        comments.addComment(AGENT, ticketId, "Replacing toner");
        comments.addComment(REQUESTER, ticketId, "Great");

        comments.close();
        tickets.close();

        assertEquals(2, notifications.size());
        assertTrue(notifications.stream().allMatch(n -> n.recipientId().equals(REQUESTER)));
    }

    private long openTicket() {
        return tickets.create(REQUESTER,
                NewTicket.of("Printer down", "Floor 3", TicketPriority.LOW, REQUESTER)).id();
    }

    private TicketEvent singleEvent(long ticketId, long afterId) throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return eventStore.listByTicket(conn, ticketId, afterId, 1).get(0);
        }
    }

    private long countEvents(long ticketId) throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return eventStore.countByTicket(conn, ticketId);
        }
    }
}
