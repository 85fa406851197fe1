package io.deskrelay.hub;

import io.deskrelay.event.TicketEvent;
import io.deskrelay.spi.MetricsExporter;
import io.deskrelay.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe router from committed ticket events to live sessions.
 *
 * <p>The hub owns two registries: sessions by user and sessions by ticket room. Both
 * are guarded by one read/write lock and never leave this class. Registration,
 * subscription and unregistration take the write lock; fan-out and the statistics
 * methods take the read lock.
 *
 * <p>{@link #broadcast} only offers the event to a bounded dispatch queue and never
 * blocks. A single dispatcher thread drains that queue: it copies the room's members
 * under the read lock, releases the lock, then offers the frame to each member's
 * outbound queue. A member whose queue is full is evicted; the others are unaffected.
 * Events dropped here stay readable through catch-up reads.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see ClientSession
 * @see HubWriterHook
 */
public final class SubscriptionHub implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SubscriptionHub.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<UUID, Set<ClientSession>> sessionsByUser = new HashMap<>();
  private final Map<Long, Set<ClientSession>> rooms = new HashMap<>();

  private final BlockingQueue<TicketEvent> dispatchQueue;
  private final ExecutorService dispatcher;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private final SessionRegistrar registrar = new Registrar();

  private SubscriptionHub(Builder builder) {
    if (builder.dispatchQueueCapacity <= 0) {
      throw new IllegalArgumentException("dispatchQueueCapacity must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.dispatchQueue = new ArrayBlockingQueue<>(builder.dispatchQueueCapacity);
    this.dispatcher = Executors.newSingleThreadExecutor(new DaemonThreadFactory("deskrelay-hub-"));
    dispatcher.submit(this::dispatchLoop);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Registration ───────────────────────────────────────────────

  /**
   * Adds a session to the user index. The session is in no room until it subscribes.
   *
   * @throws IllegalStateException if the hub is closed
   */
  public void register(ClientSession session) {
    Objects.requireNonNull(session, "session");
    if (!accepting.get()) {
      throw new IllegalStateException("SubscriptionHub is closed");
    }
    int connections;
    int roomCount;
    lock.writeLock().lock();
    try {
      // close() sets accepting before snapshotting sessions under the lock
      if (!accepting.get()) {
        throw new IllegalStateException("SubscriptionHub is closed");
      }
      sessionsByUser.computeIfAbsent(session.userId(), k -> new LinkedHashSet<>()).add(session);
      session.attach(registrar);
      connections = countConnections();
      roomCount = rooms.size();
    } finally {
      lock.writeLock().unlock();
    }
    metrics.recordRegistrySize(connections, roomCount);
    logger.log(Level.FINE, "Registered {0}", session);
  }

  /**
   * Removes a session from every room and from the user index, then closes its
   * outbound queue. Safe to call any number of times and from any thread; only the
   * first call has an effect.
   */
  public void unregister(ClientSession session) {
    Objects.requireNonNull(session, "session");
    boolean removed;
    int connections;
    int roomCount;
    lock.writeLock().lock();
    try {
      Set<ClientSession> userSessions = sessionsByUser.get(session.userId());
      removed = userSessions != null && userSessions.remove(session);
      if (userSessions != null && userSessions.isEmpty()) {
        sessionsByUser.remove(session.userId());
      }
      for (Long ticketId : session.subscriptions()) {
        leaveRoom(session, ticketId);
      }
      session.clearSubscriptions();
      connections = countConnections();
      roomCount = rooms.size();
    } finally {
      lock.writeLock().unlock();
    }
    session.closeOutbound();
    if (removed) {
      metrics.recordRegistrySize(connections, roomCount);
      logger.log(Level.FINE, "Unregistered {0}", session);
    }
  }

  /**
   * Adds a registered session to a ticket's room.
   *
   * @return {@code false} if the ticket id is not positive or the session is not registered
   */
  public boolean subscribe(ClientSession session, long ticketId) {
    Objects.requireNonNull(session, "session");
    if (ticketId <= 0) {
      return false;
    }
    lock.writeLock().lock();
    try {
      if (!isRegistered(session)) {
        return false;
      }
      rooms.computeIfAbsent(ticketId, k -> new LinkedHashSet<>()).add(session);
      session.addSubscription(ticketId);
    } finally {
      lock.writeLock().unlock();
    }
    logger.log(Level.FINE, "{0} subscribed to ticket {1}", new Object[]{session, ticketId});
    return true;
  }

  public void unsubscribe(ClientSession session, long ticketId) {
    Objects.requireNonNull(session, "session");
    lock.writeLock().lock();
    try {
      leaveRoom(session, ticketId);
      session.removeSubscription(ticketId);
    } finally {
      lock.writeLock().unlock();
    }
    logger.log(Level.FINE, "{0} unsubscribed from ticket {1}", new Object[]{session, ticketId});
  }

  // ── Delivery ───────────────────────────────────────────────────

  /**
   * Offers a committed event for fan-out to its ticket's room. Never blocks.
   *
   * @return {@code false} if the event was dropped because the dispatch queue is full
   * or the hub is closed
   */
  public boolean broadcast(TicketEvent event) {
    Objects.requireNonNull(event, "event");
    if (!accepting.get()) {
      metrics.incrementBroadcastDropped();
      logger.log(Level.WARNING, "Hub closed, dropping eventId=" + event.id() + " for ticket " + event.ticketId());
      return false;
    }
    boolean enqueued = dispatchQueue.offer(event);
    if (enqueued) {
      metrics.incrementBroadcastEnqueued();
    } else {
      metrics.incrementBroadcastDropped();
      logger.log(Level.WARNING, "Dispatch queue full, dropping eventId=" + event.id()
          + " for ticket " + event.ticketId() + "; subscribers must catch up");
    }
    metrics.recordDispatchQueueDepth(dispatchQueue.size());
    return enqueued;
  }

  /**
   * Offers a frame to every session of one user. Sessions with a full queue are
   * skipped, not evicted.
   *
   * @return number of sessions that accepted the frame
   */
  public int sendToUser(UUID userId, OutboundMessage message) {
    Objects.requireNonNull(message, "message");
    List<ClientSession> targets;
    lock.readLock().lock();
    try {
      Set<ClientSession> userSessions = sessionsByUser.get(userId);
      targets = userSessions == null ? List.of() : new ArrayList<>(userSessions);
    } finally {
      lock.readLock().unlock();
    }
    int accepted = 0;
    for (ClientSession session : targets) {
      OutboundQueue.Offer result = session.offer(message);
      if (result == OutboundQueue.Offer.ACCEPTED) {
        accepted++;
        metrics.incrementDelivered();
      } else if (result == OutboundQueue.Offer.FULL) {
        logger.log(Level.FINE, "Outbound queue full, skipping direct message to {0}", session);
      }
    }
    return accepted;
  }

  private void dispatchLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && dispatchQueue.isEmpty()) {
          break;
        }
        TicketEvent event = dispatchQueue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (event == null) {
          if (!running.get()) break;
          continue;
        }
        fanOut(event);
        metrics.recordDispatchQueueDepth(dispatchQueue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Hub dispatch loop error", t);
      }
    }
  }

  private void fanOut(TicketEvent event) {
    List<ClientSession> members;
    lock.readLock().lock();
    try {
      Set<ClientSession> room = rooms.get(event.ticketId());
      members = room == null ? List.of() : new ArrayList<>(room);
    } finally {
      lock.readLock().unlock();
    }
    if (members.isEmpty()) {
      return;
    }
    OutboundMessage message = OutboundMessage.event(event);
    for (ClientSession session : members) {
      switch (session.offer(message)) {
        case ACCEPTED -> metrics.incrementDelivered();
        case FULL -> evict(session, event);
        case CLOSED -> {
          // already being torn down
        }
      }
    }
  }

  private void evict(ClientSession session, TicketEvent event) {
    metrics.incrementSessionsEvicted();
    logger.log(Level.WARNING, "Outbound queue full, evicting " + session
        + " while delivering eventId=" + event.id());
    unregister(session);
  }

  // ── Statistics ─────────────────────────────────────────────────

  /** Number of registered sessions across all users. */
  public int connectionCount() {
    lock.readLock().lock();
    try {
      return countConnections();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Number of tickets with at least one subscribed session. */
  public int roomCount() {
    lock.readLock().lock();
    try {
      return rooms.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Number of sessions currently subscribed to the ticket. */
  public int roomMembership(long ticketId) {
    lock.readLock().lock();
    try {
      Set<ClientSession> room = rooms.get(ticketId);
      return room == null ? 0 : room.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isUserConnected(UUID userId) {
    lock.readLock().lock();
    try {
      return sessionsByUser.containsKey(userId);
    } finally {
      lock.readLock().unlock();
    }
  }

  // Callers hold the lock.
  private int countConnections() {
    int count = 0;
    for (Set<ClientSession> userSessions : sessionsByUser.values()) {
      count += userSessions.size();
    }
    return count;
  }

  // Callers hold the write lock.
  private boolean isRegistered(ClientSession session) {
    Set<ClientSession> userSessions = sessionsByUser.get(session.userId());
    return userSessions != null && userSessions.contains(session);
  }

  // Callers hold the write lock.
  private void leaveRoom(ClientSession session, long ticketId) {
    Set<ClientSession> room = rooms.get(ticketId);
    if (room != null && room.remove(session) && room.isEmpty()) {
      rooms.remove(ticketId);
    }
  }

  /**
   * Stops accepting broadcasts, fans out what is already queued within the drain
   * timeout, then unregisters every session, which closes their connections.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    running.set(false);
    dispatcher.shutdown();
    try {
      if (!dispatcher.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: " + dispatchQueue.size());
        dispatcher.shutdownNow();
        dispatcher.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      dispatcher.shutdownNow();
      Thread.currentThread().interrupt();
    }

    List<ClientSession> remaining = new ArrayList<>();
    lock.readLock().lock();
    try {
      sessionsByUser.values().forEach(remaining::addAll);
    } finally {
      lock.readLock().unlock();
    }
    for (ClientSession session : remaining) {
      unregister(session);
    }
  }

  private final class Registrar implements SessionRegistrar {
    @Override
    public boolean join(ClientSession session, long ticketId) {
      return subscribe(session, ticketId);
    }

    @Override
    public void leave(ClientSession session, long ticketId) {
      unsubscribe(session, ticketId);
    }

    @Override
    public void release(ClientSession session) {
      unregister(session);
    }
  }

  /** Builder for {@link SubscriptionHub}. */
  public static final class Builder {
    private int dispatchQueueCapacity = 256;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the capacity of the dispatch queue between committing threads and the
     * dispatcher. When full, further broadcasts are dropped.
     *
     * <p>Optional. Defaults to {@code 256}.
     *
     * @param dispatchQueueCapacity queue capacity
     * @return this builder
     */
    public Builder dispatchQueueCapacity(int dispatchQueueCapacity) {
      this.dispatchQueueCapacity = dispatchQueueCapacity;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for queued events to be fanned out.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public SubscriptionHub build() {
      return new SubscriptionHub(this);
    }
  }
}
