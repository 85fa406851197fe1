package io.deskrelay.hub;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and sizing limits applied to every client session.
 *
 * <p>Create instances via {@link #builder()}; {@link #defaults()} returns the
 * standard values.
 */
public final class SessionSettings {
  private static final SessionSettings DEFAULTS = builder().build();

  private final Duration readTimeout;
  private final Duration writeTimeout;
  private final Duration keepaliveInterval;
  private final int maxFrameBytes;
  private final int outboundQueueCapacity;

  private SessionSettings(Builder builder) {
    this.readTimeout = Objects.requireNonNull(builder.readTimeout, "readTimeout");
    this.writeTimeout = Objects.requireNonNull(builder.writeTimeout, "writeTimeout");
    this.keepaliveInterval = builder.keepaliveInterval != null
        ? builder.keepaliveInterval
        : readTimeout.multipliedBy(9).dividedBy(10);
    this.maxFrameBytes = builder.maxFrameBytes;
    this.outboundQueueCapacity = builder.outboundQueueCapacity;

    if (readTimeout.isZero() || readTimeout.isNegative()) {
      throw new IllegalArgumentException("readTimeout must be > 0");
    }
    if (writeTimeout.isZero() || writeTimeout.isNegative()) {
      throw new IllegalArgumentException("writeTimeout must be > 0");
    }
    if (keepaliveInterval.isZero() || keepaliveInterval.isNegative()
        || keepaliveInterval.compareTo(readTimeout) >= 0) {
      throw new IllegalArgumentException("keepaliveInterval must be > 0 and shorter than readTimeout");
    }
    if (maxFrameBytes <= 0) {
      throw new IllegalArgumentException("maxFrameBytes must be > 0");
    }
    if (outboundQueueCapacity <= 0) {
      throw new IllegalArgumentException("outboundQueueCapacity must be > 0");
    }
  }

  public static SessionSettings defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Duration readTimeout() {
    return readTimeout;
  }

  public Duration writeTimeout() {
    return writeTimeout;
  }

  public Duration keepaliveInterval() {
    return keepaliveInterval;
  }

  public int maxFrameBytes() {
    return maxFrameBytes;
  }

  public int outboundQueueCapacity() {
    return outboundQueueCapacity;
  }

  /** Builder for {@link SessionSettings}. */
  public static final class Builder {
    private Duration readTimeout = Duration.ofSeconds(60);
    private Duration writeTimeout = Duration.ofSeconds(10);
    private Duration keepaliveInterval;
    private int maxFrameBytes = 1024;
    private int outboundQueueCapacity = 256;

    private Builder() {}

    /**
     * Sets the rolling read deadline. A session that receives neither a frame nor a
     * keepalive reply within this window is closed.
     *
     * <p>Optional. Defaults to 60 seconds.
     *
     * @param readTimeout the read window
     * @return this builder
     */
    public Builder readTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    /**
     * Sets the deadline for writing one frame.
     *
     * <p>Optional. Defaults to 10 seconds.
     *
     * @param writeTimeout the write deadline
     * @return this builder
     */
    public Builder writeTimeout(Duration writeTimeout) {
      this.writeTimeout = writeTimeout;
      return this;
    }

    /**
     * Sets how often a keepalive probe is sent. Must be shorter than the read timeout.
     *
     * <p>Optional. Defaults to nine tenths of the read timeout (54 seconds).
     *
     * @param keepaliveInterval the probe interval
     * @return this builder
     */
    public Builder keepaliveInterval(Duration keepaliveInterval) {
      this.keepaliveInterval = keepaliveInterval;
      return this;
    }

    /**
     * Sets the largest inbound frame accepted; a larger frame closes the session.
     *
     * <p>Optional. Defaults to {@code 1024} bytes.
     *
     * @param maxFrameBytes limit in bytes
     * @return this builder
     */
    public Builder maxFrameBytes(int maxFrameBytes) {
      this.maxFrameBytes = maxFrameBytes;
      return this;
    }

    /**
     * Sets the capacity of each session's outbound queue. A session whose queue is
     * full when an event is fanned out is evicted.
     *
     * <p>Optional. Defaults to {@code 256}.
     *
     * @param outboundQueueCapacity queue capacity
     * @return this builder
     */
    public Builder outboundQueueCapacity(int outboundQueueCapacity) {
      this.outboundQueueCapacity = outboundQueueCapacity;
      return this;
    }

    public SessionSettings build() {
      return new SessionSettings(this);
    }
  }
}
