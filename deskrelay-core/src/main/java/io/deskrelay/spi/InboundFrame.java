package io.deskrelay.spi;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A frame read from a realtime connection: either a text message or the peer's
 * reply to a keepalive probe.
 *
 * @param kind frame kind
 * @param text message text, {@code null} for keepalive replies
 */
public record InboundFrame(Kind kind, String text) {

    public enum Kind { TEXT, KEEPALIVE }

    public InboundFrame {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.TEXT) {
            Objects.requireNonNull(text, "text");
        }
    }

    public static InboundFrame text(String text) {
        return new InboundFrame(Kind.TEXT, text);
    }

    public static InboundFrame keepalive() {
        return new InboundFrame(Kind.KEEPALIVE, null);
    }

    /**
     * Returns the encoded size of the frame payload in bytes.
     */
    public int sizeBytes() {
        return text == null ? 0 : text.getBytes(StandardCharsets.UTF_8).length;
    }
}
