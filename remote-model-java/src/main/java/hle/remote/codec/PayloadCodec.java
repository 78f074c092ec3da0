package hle.remote.codec;

import com.google.gson.JsonElement;

/**
 * Translates domain values to and from the JSON trees carried by both transports.
 *
 * <p>Implementations must be thread-safe: one codec serves every call of a proxy.
 */
public interface PayloadCodec {

    /**
     * Encodes one value as a JSON tree.
     *
     * @throws PayloadCodecException if the value cannot be represented
     */
    JsonElement toJson(Object value);

    /**
     * Decodes one value of the given type from a JSON tree.
     *
     * @throws PayloadCodecException if the tree does not match the type
     */
    <T> T fromJson(JsonElement json, Class<T> type);

    /**
     * Encodes one value as UTF-8 JSON bytes.
     */
    byte[] encode(Object value);

    /**
     * Decodes one value of the given type from UTF-8 JSON bytes.
     */
    <T> T decode(byte[] payload, Class<T> type);
}
