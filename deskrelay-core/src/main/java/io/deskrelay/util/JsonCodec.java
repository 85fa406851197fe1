package io.deskrelay.util;

/**
 * Encodes snapshots and wire frames to JSON and decodes inbound control frames.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) is backed by a shared
 * Jackson {@code ObjectMapper} with Java time support. Integrators that already
 * configure their own mapper can wrap it with {@link JacksonJsonCodec#JacksonJsonCodec(com.fasterxml.jackson.databind.ObjectMapper)}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Serializes a value to a JSON string.
     *
     * @param value record, map or other Jackson-serializable value
     * @return JSON text, never {@code null}
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    String toJson(Object value);

    /**
     * Parses JSON text into the given type. Unknown properties are ignored.
     *
     * @param json the JSON text
     * @param type target type
     * @return parsed value, or {@code null} for the literal {@code null}
     * @throws IllegalArgumentException if the text is not valid JSON for the type
     */
    <T> T fromJson(String json, Class<T> type);
}
