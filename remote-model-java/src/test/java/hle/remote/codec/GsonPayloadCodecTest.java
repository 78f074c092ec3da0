package hle.remote.codec;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import hle.remote.testing.SampleInput;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GsonPayloadCodec.
 */
class GsonPayloadCodecTest {

    private final PayloadCodec codec = new GsonPayloadCodec();

    @Test
    void shouldEncodeFieldsAsJson() {
        JsonElement json = codec.toJson(new SampleInput("Test"));

        assertEquals("Test", json.getAsJsonObject().get("name").getAsString());
        assertEquals("{\"name\":\"Test\"}", new String(codec.encode(new SampleInput("Test")), StandardCharsets.UTF_8));
    }

    @Test
    void shouldDecodeFromTreeAndBytes() {
        assertEquals(new SampleInput("Test"), codec.fromJson(JsonParser.parseString("{\"name\":\"Test\"}"), SampleInput.class));
        assertEquals(new SampleInput("Ünï"), codec.decode("{\"name\":\"Ünï\"}".getBytes(StandardCharsets.UTF_8), SampleInput.class));
    }

    @Test
    void shouldReportMalformedPayloads() {
        assertThrows(PayloadCodecException.class,
            () -> codec.decode("{\"name\":".getBytes(StandardCharsets.UTF_8), SampleInput.class));
        assertThrows(PayloadCodecException.class,
            () -> codec.fromJson(JsonParser.parseString("[1, 2]"), SampleInput.class));
    }
}
