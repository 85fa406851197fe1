package io.deskrelay.hub;

import io.deskrelay.AuthenticationException;
import io.deskrelay.spi.CredentialVerifier;
import io.deskrelay.spi.SessionTransport;
import io.deskrelay.util.DaemonThreadFactory;
import io.deskrelay.util.JsonCodec;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for new realtime connections.
 *
 * <p>The bearer credential is verified before the transport is opened, so no
 * anonymous session ever exists. An accepted connection becomes a
 * {@link ClientSession} registered with the hub, with its two I/O tasks running on
 * the gateway's daemon threads.
 *
 * <p>Closing the gateway unregisters the sessions it opened from the hub, which ends
 * them through their outbound queues, then waits for their threads. The hub may be
 * closed before or after the gateway.
 */
public final class SessionGateway implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SessionGateway.class.getName());

  private final SubscriptionHub hub;
  private final CredentialVerifier credentialVerifier;
  private final SessionSettings settings;
  private final JsonCodec jsonCodec;
  private final SubscriptionPolicy subscriptionPolicy;
  private final long shutdownTimeoutMs;
  private final ExecutorService sessionThreads;
  private final Set<ClientSession> sessions = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean open = new AtomicBoolean(true);

  private SessionGateway(Builder builder) {
    this.hub = Objects.requireNonNull(builder.hub, "hub");
    this.credentialVerifier = Objects.requireNonNull(builder.credentialVerifier, "credentialVerifier");
    this.settings = builder.settings != null ? builder.settings : SessionSettings.defaults();
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.subscriptionPolicy = builder.subscriptionPolicy != null
        ? builder.subscriptionPolicy : SubscriptionPolicy.ALLOW_ALL;
    this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
    this.sessionThreads = Executors.newCachedThreadPool(new DaemonThreadFactory("deskrelay-session-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolves the user behind a credential.
   *
   * @throws AuthenticationException if the credential is missing, invalid or cannot be checked
   */
  public UUID authenticate(String credential) {
    if (credential == null || credential.isBlank()) {
      throw new AuthenticationException("Missing credential");
    }
    Optional<UUID> userId;
    try {
      userId = credentialVerifier.verify(credential);
    } catch (RuntimeException e) {
      throw new AuthenticationException("Credential verification failed", e);
    }
    return userId.orElseThrow(() -> new AuthenticationException("Invalid or expired credential"));
  }

  /**
   * Authenticates, then opens the transport and starts a session for it.
   *
   * @param credential bearer credential supplied with the connection request
   * @param upgrade    opens the transport; only invoked after authentication succeeded
   * @return the running session
   * @throws AuthenticationException if the credential is rejected; {@code upgrade} is not invoked
   */
  public ClientSession accept(String credential, Supplier<? extends SessionTransport> upgrade) {
    Objects.requireNonNull(upgrade, "upgrade");
    UUID userId = authenticate(credential);
    return open(userId, Objects.requireNonNull(upgrade.get(), "transport"));
  }

  /**
   * Starts a session for an already authenticated user.
   *
   * @throws IllegalStateException if the gateway or hub is closed; the transport is closed
   */
  public ClientSession open(UUID userId, SessionTransport transport) {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(transport, "transport");
    if (!open.get()) {
      transport.close();
      throw new IllegalStateException("SessionGateway is closed");
    }
    ClientSession session = new ClientSession(userId, transport, settings, jsonCodec, subscriptionPolicy);
    try {
      hub.register(session);
      session.start(sessionThreads);
    } catch (RuntimeException e) {
      hub.unregister(session);
      transport.close();
      throw e;
    }
    sessions.removeIf(s -> !s.isOpen());
    sessions.add(session);
    if (!open.get()) {
      // close() may have taken its snapshot before the add
      hub.unregister(session);
    }
    logger.log(Level.FINE, "Accepted {0} from {1}", new Object[]{session, transport.remoteAddress()});
    return session;
  }

  public SessionSettings settings() {
    return settings;
  }

  /**
   * Stops accepting connections, ends the sessions opened here and waits for their
   * threads to finish.
   */
  @Override
  public void close() {
    if (!open.compareAndSet(true, false)) {
      return;
    }
    for (ClientSession session : sessions) {
      hub.unregister(session);
    }
    sessions.clear();
    sessionThreads.shutdown();
    try {
      if (!sessionThreads.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Session threads still running after " + shutdownTimeoutMs
            + " ms; interrupting");
        sessionThreads.shutdownNow();
      }
    } catch (InterruptedException e) {
      sessionThreads.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link SessionGateway}. */
  public static final class Builder {
    private SubscriptionHub hub;
    private CredentialVerifier credentialVerifier;
    private SessionSettings settings;
    private JsonCodec jsonCodec;
    private SubscriptionPolicy subscriptionPolicy;
    private long shutdownTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the hub sessions are registered with.
     *
     * <p><b>Required.</b>
     */
    public Builder hub(SubscriptionHub hub) {
      this.hub = hub;
      return this;
    }

    /**
     * Sets the verifier resolving bearer credentials to user ids.
     *
     * <p><b>Required.</b>
     */
    public Builder credentialVerifier(CredentialVerifier credentialVerifier) {
      this.credentialVerifier = credentialVerifier;
      return this;
    }

    /**
     * Sets session timing and sizing.
     *
     * <p>Optional. Defaults to {@link SessionSettings#defaults()}.
     */
    public Builder settings(SessionSettings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Sets the codec for control and server frames.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets the policy deciding which ticket rooms a user may join.
     *
     * <p>Optional. Defaults to {@link SubscriptionPolicy#ALLOW_ALL}.
     */
    public Builder subscriptionPolicy(SubscriptionPolicy subscriptionPolicy) {
      this.subscriptionPolicy = subscriptionPolicy;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for session threads.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
      this.shutdownTimeoutMs = shutdownTimeoutMs;
      return this;
    }

    public SessionGateway build() {
      return new SessionGateway(this);
    }
  }
}
