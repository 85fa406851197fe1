package io.deskrelay.spi;

import java.io.IOException;
import java.time.Duration;

/**
 * The connection handle of one realtime client, typically an upgraded WebSocket.
 *
 * <p>A session uses exactly two threads against a transport: one calling
 * {@link #read}, the other calling {@link #write} and {@link #sendKeepalive}.
 * Implementations must allow {@link #close()} from any thread and make it
 * unblock a pending {@code read}.
 */
public interface SessionTransport {

    /**
     * Blocks until the next frame arrives or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return the next frame
     * @throws java.net.SocketTimeoutException if no frame arrived within the timeout
     * @throws IOException if the connection failed or was closed
     */
    InboundFrame read(Duration timeout) throws IOException;

    /**
     * Sends one text frame.
     *
     * @param text    the encoded frame
     * @param timeout write deadline; exceeding it must fail with an {@code IOException}
     */
    void write(String text, Duration timeout) throws IOException;

    /**
     * Sends a keepalive probe (a WebSocket ping) the peer is expected to answer.
     */
    void sendKeepalive(Duration timeout) throws IOException;

    /**
     * Sends a close frame if possible and releases the connection. Idempotent.
     */
    void close();

    /**
     * Describes the peer for log messages.
     */
    default String remoteAddress() {
        return "unknown";
    }
}
