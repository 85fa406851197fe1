package io.deskrelay.hub;

import io.deskrelay.spi.InboundFrame;
import io.deskrelay.spi.SessionTransport;
import io.deskrelay.util.JsonCodec;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One live realtime connection of an authenticated user.
 *
 * <p>A session runs two tasks that share only the {@link OutboundQueue} and the
 * {@link SessionTransport}:
 * <ul>
 *   <li>the <em>inbound</em> task reads control frames under a rolling read deadline and
 *       joins or leaves ticket rooms through its {@link SessionRegistrar};</li>
 *   <li>the <em>outbound</em> task writes queued frames under a write deadline and sends a
 *       keepalive probe every keepalive interval.</li>
 * </ul>
 * Whichever task ends first releases the session from the hub. Release happens
 * once; the hub then closes the outbound queue, which stops the outbound task, which
 * closes the transport, which unblocks the inbound task.
 *
 * <p>The subscription set is guarded by its own lock and is what the hub consults
 * to know which rooms to leave on unregistration.
 *
 * @see SubscriptionHub
 * @see SessionGateway
 */
public final class ClientSession {
  private static final Logger logger = Logger.getLogger(ClientSession.class.getName());

  private static final AtomicLong SEQUENCE = new AtomicLong();
  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final long id;
  private final UUID userId;
  private final SessionTransport transport;
  private final SessionSettings settings;
  private final OutboundQueue outbound;
  private final JsonCodec jsonCodec;
  private final SubscriptionPolicy subscriptionPolicy;

  private final ReentrantReadWriteLock subscriptionLock = new ReentrantReadWriteLock();
  private final Set<Long> subscriptions = new HashSet<>();

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean released = new AtomicBoolean(false);
  private final CountDownLatch tasksDone = new CountDownLatch(2);
  private volatile SessionRegistrar registrar;

  ClientSession(UUID userId, SessionTransport transport, SessionSettings settings,
                JsonCodec jsonCodec, SubscriptionPolicy subscriptionPolicy) {
    this.id = SEQUENCE.incrementAndGet();
    this.userId = Objects.requireNonNull(userId, "userId");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.subscriptionPolicy = subscriptionPolicy == null ? SubscriptionPolicy.ALLOW_ALL : subscriptionPolicy;
    this.outbound = new OutboundQueue(settings.outboundQueueCapacity());
  }

  public long id() {
    return id;
  }

  public UUID userId() {
    return userId;
  }

  public String remoteAddress() {
    return transport.remoteAddress();
  }

  /**
   * Returns {@code false} once the session has been released or evicted.
   */
  public boolean isOpen() {
    return !outbound.isClosed();
  }

  /**
   * Returns a copy of the tickets this session is subscribed to.
   */
  public Set<Long> subscriptions() {
    subscriptionLock.readLock().lock();
    try {
      return Set.copyOf(subscriptions);
    } finally {
      subscriptionLock.readLock().unlock();
    }
  }

  public boolean isSubscribed(long ticketId) {
    subscriptionLock.readLock().lock();
    try {
      return subscriptions.contains(ticketId);
    } finally {
      subscriptionLock.readLock().unlock();
    }
  }

  /**
   * Waits until both I/O tasks have ended.
   *
   * @return {@code true} if both ended within the timeout
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return tasksDone.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  // ── Hub-facing operations ──────────────────────────────────────

  void attach(SessionRegistrar registrar) {
    this.registrar = registrar;
  }

  OutboundQueue.Offer offer(OutboundMessage message) {
    return outbound.offer(message);
  }

  int pendingOutbound() {
    return outbound.size();
  }

  void closeOutbound() {
    if (outbound.close()) {
      logger.log(Level.FINE, "Outbound queue closed for session {0}", id);
    }
  }

  boolean addSubscription(long ticketId) {
    subscriptionLock.writeLock().lock();
    try {
      return subscriptions.add(ticketId);
    } finally {
      subscriptionLock.writeLock().unlock();
    }
  }

  boolean removeSubscription(long ticketId) {
    subscriptionLock.writeLock().lock();
    try {
      return subscriptions.remove(ticketId);
    } finally {
      subscriptionLock.writeLock().unlock();
    }
  }

  void clearSubscriptions() {
    subscriptionLock.writeLock().lock();
    try {
      subscriptions.clear();
    } finally {
      subscriptionLock.writeLock().unlock();
    }
  }

  // ── I/O tasks ──────────────────────────────────────────────────

  /**
   * Starts the inbound and outbound tasks on the given executor. The executor must
   * run both concurrently.
   *
   * @throws IllegalStateException if already started
   */
  void start(Executor executor) {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Session " + id + " already started");
    }
    executor.execute(this::writeLoop);
    executor.execute(this::readLoop);
  }

  private void readLoop() {
    String reason = "inbound closed";
    long windowNanos = settings.readTimeout().toNanos();
    long deadline = System.nanoTime() + windowNanos;
    try {
      while (!outbound.isClosed()) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          reason = "read deadline expired";
          break;
        }
        InboundFrame frame = transport.read(Duration.ofNanos(remaining));
        deadline = System.nanoTime() + windowNanos;
        if (frame.kind() == InboundFrame.Kind.KEEPALIVE) {
          continue;
        }
        if (frame.sizeBytes() > settings.maxFrameBytes()) {
          reason = "frame of " + frame.sizeBytes() + " bytes exceeds limit of " + settings.maxFrameBytes();
          break;
        }
        handleText(frame.text());
      }
    } catch (SocketTimeoutException e) {
      reason = "read deadline expired";
    } catch (IOException e) {
      reason = "read failed: " + e.getMessage();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Inbound task of session " + id + " failed", e);
      reason = "inbound error";
    } finally {
      release(reason);
      tasksDone.countDown();
    }
  }

  private void writeLoop() {
    String reason = "outbound queue closed";
    long keepaliveNanos = settings.keepaliveInterval().toNanos();
    long nextKeepalive = System.nanoTime() + keepaliveNanos;
    try {
      while (!outbound.isClosed()) {
        long untilKeepalive = nextKeepalive - System.nanoTime();
        long waitNanos = Math.max(0, Math.min(untilKeepalive, TimeUnit.MILLISECONDS.toNanos(QUEUE_POLL_TIMEOUT_MS)));
        OutboundMessage message = outbound.poll(waitNanos, TimeUnit.NANOSECONDS);
        if (message != null && !outbound.isClosed()) {
          transport.write(jsonCodec.toJson(message), settings.writeTimeout());
        }
        if (System.nanoTime() - nextKeepalive >= 0) {
          transport.sendKeepalive(settings.writeTimeout());
          nextKeepalive = System.nanoTime() + keepaliveNanos;
        }
      }
    } catch (IOException e) {
      reason = "write failed: " + e.getMessage();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      reason = "outbound task interrupted";
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Outbound task of session " + id + " failed", e);
      reason = "outbound error";
    } finally {
      transport.close();
      release(reason);
      tasksDone.countDown();
    }
  }

  private void handleText(String text) {
    ControlMessage message;
    try {
      message = jsonCodec.fromJson(text, ControlMessage.class);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "Ignoring malformed frame on session {0}: {1}", new Object[]{id, e.getMessage()});
      return;
    }
    if (message == null || message.type() == null) {
      logger.log(Level.FINE, "Ignoring frame without type on session {0}", id);
      return;
    }
    switch (message.type()) {
      case ControlMessage.SUBSCRIBE -> join(message.targetTicketId());
      case ControlMessage.UNSUBSCRIBE -> leave(message.targetTicketId());
      case ControlMessage.PING -> {
        if (outbound.offer(OutboundMessage.pong()) == OutboundQueue.Offer.FULL) {
          logger.log(Level.FINE, "Outbound queue full, skipping pong on session {0}", id);
        }
      }
      default -> logger.log(Level.FINE, "Ignoring unknown message type {0} on session {1}",
          new Object[]{message.type(), id});
    }
  }

  private void join(Long ticketId) {
    SessionRegistrar current = registrar;
    if (ticketId == null || ticketId <= 0 || current == null) {
      return;
    }
    if (!subscriptionPolicy.mayJoin(userId, ticketId)) {
      logger.log(Level.FINE, "User {0} may not subscribe to ticket {1}", new Object[]{userId, ticketId});
      return;
    }
    current.join(this, ticketId);
  }

  private void leave(Long ticketId) {
    SessionRegistrar current = registrar;
    if (ticketId == null || ticketId <= 0 || current == null) {
      return;
    }
    current.leave(this, ticketId);
  }

  private void release(String reason) {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    logger.log(Level.FINE, "Session {0} of user {1} ending: {2}", new Object[]{id, userId, reason});
    SessionRegistrar current = registrar;
    if (current != null) {
      current.release(this);
    } else {
      closeOutbound();
    }
  }

  @Override
  public String toString() {
    return "ClientSession{id=" + id + ", userId=" + userId + '}';
  }
}
