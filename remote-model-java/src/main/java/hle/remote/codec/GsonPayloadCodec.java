package hle.remote.codec;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link PayloadCodec} backed by Gson. Value classes are mapped field by field.
 */
public class GsonPayloadCodec implements PayloadCodec {

    private final Gson gson;

    public GsonPayloadCodec() {
        this(new Gson());
    }

    public GsonPayloadCodec(Gson gson) {
        this.gson = Objects.requireNonNull(gson, "gson cannot be null");
    }

    @Override
    public JsonElement toJson(Object value) {
        try {
            return gson.toJsonTree(value);
        } catch (RuntimeException e) {
            throw new PayloadCodecException("Failed to encode " + describe(value), e);
        }
    }

    @Override
    public <T> T fromJson(JsonElement json, Class<T> type) {
        try {
            return gson.fromJson(json, type);
        } catch (JsonParseException | IllegalStateException | ClassCastException e) {
            throw new PayloadCodecException("Failed to decode " + type.getSimpleName() + " from " + json, e);
        }
    }

    @Override
    public byte[] encode(Object value) {
        return gson.toJson(toJson(value)).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public <T> T decode(byte[] payload, Class<T> type) {
        String json = new String(payload, StandardCharsets.UTF_8);
        try {
            return fromJson(JsonParser.parseString(json), type);
        } catch (JsonParseException e) {
            throw new PayloadCodecException("Malformed JSON payload for " + type.getSimpleName() + ": " + json, e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
