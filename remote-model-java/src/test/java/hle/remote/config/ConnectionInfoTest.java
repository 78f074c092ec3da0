package hle.remote.config;

import hle.remote.client.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConnectionInfo construction and parsing.
 */
class ConnectionInfoTest {

    @Test
    void shouldBuildWithDefaults() {
        ConnectionInfo info = ConnectionInfo.builder()
            .host(" localhost ")
            .port(8085)
            .build();

        assertEquals("localhost", info.getHost());
        assertEquals(8085, info.getPort());
        assertEquals(Protocol.GRPC, info.getProtocol());
        assertFalse(info.getTls().isEnabled());
        assertFalse(info.getTimeout().isPresent());
        assertFalse(info.getMaxReceiveMessageLength().isPresent());
        assertEquals("localhost:8085", info.getAuthority());
    }

    @Test
    void shouldBracketIpv6Authority() {
        ConnectionInfo info = ConnectionInfo.builder().host("::1").port(443).build();

        assertEquals("[::1]:443", info.getAuthority());
    }

    @Test
    void shouldRejectBlankHost() {
        assertThrows(ConfigurationException.class, () -> ConnectionInfo.builder().port(80).build());
        assertThrows(ConfigurationException.class, () -> ConnectionInfo.builder().host("  ").port(80).build());
    }

    @Test
    void shouldRejectPortOutOfRange() {
        assertThrows(ConfigurationException.class, () -> ConnectionInfo.builder().host("h").port(0).build());
        assertThrows(ConfigurationException.class, () -> ConnectionInfo.builder().host("h").port(65536).build());
        assertDoesNotThrow(() -> ConnectionInfo.builder().host("h").port(65535).build());
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        assertThrows(ConfigurationException.class,
            () -> ConnectionInfo.builder().host("h").port(80).timeout(Duration.ZERO).build());
    }

    @Test
    void shouldParseConnectionBlock() {
        Map<String, Object> tls = new HashMap<>();
        tls.put("enabled", true);
        tls.put("ca_file", "/etc/ca.pem");
        tls.put("cert_file", "/etc/client.pem");
        tls.put("key_file", "/etc/client-key.pem");

        Map<String, Object> options = new HashMap<>();
        options.put(ConnectionInfo.OPTION_MAX_RECEIVE_MESSAGE_LENGTH, 8388608);
        options.put(ConnectionInfo.OPTION_KEEPALIVE_TIME_MS, "30000");

        Map<String, Object> block = new HashMap<>();
        block.put("hostname", "models.internal");
        block.put("port", "8085");
        block.put("protocol", "GRPC");
        block.put("timeout", 2.5);
        block.put("options", options);
        block.put("tls", tls);

        ConnectionInfo info = ConnectionInfo.fromMap(block);

        assertEquals("models.internal", info.getHost());
        assertEquals(8085, info.getPort());
        assertEquals(Protocol.GRPC, info.getProtocol());
        assertEquals(Duration.ofMillis(2500), info.getTimeout().orElse(null));
        assertEquals(8388608, info.getMaxReceiveMessageLength().getAsInt());
        assertEquals(30000L, info.getKeepAliveTimeMs().getAsLong());
        assertTrue(info.getTls().isEnabled());
        assertTrue(info.getTls().isMutual());
        assertEquals(Paths.get("/etc/ca.pem"), info.getTls().getCaFile().orElse(null));
    }

    @Test
    void shouldAcceptHostAliasAndDefaultProtocol() {
        Map<String, Object> block = new HashMap<>();
        block.put("host", "localhost");
        block.put("port", 9000);

        ConnectionInfo info = ConnectionInfo.fromMap(block);

        assertEquals("localhost", info.getHost());
        assertEquals(Protocol.GRPC, info.getProtocol());
        assertEquals(TlsConfig.disabled(), info.getTls());
    }

    @Test
    void shouldIgnoreUnknownOptions() {
        Map<String, Object> block = new HashMap<>();
        block.put("hostname", "localhost");
        block.put("port", 9000);
        block.put("options", Map.of("grpc.some_future_knob", 1));

        ConnectionInfo info = ConnectionInfo.fromMap(block);

        assertFalse(info.getMaxReceiveMessageLength().isPresent());
        assertFalse(info.getKeepAliveTimeMs().isPresent());
    }

    @Test
    void shouldRejectMalformedBlocks() {
        assertThrows(ConfigurationException.class, () -> ConnectionInfo.fromMap(null));
        assertThrows(ConfigurationException.class,
            () -> ConnectionInfo.fromMap(Map.of("hostname", "h", "port", "eighty")));
        assertThrows(ConfigurationException.class,
            () -> ConnectionInfo.fromMap(Map.of("hostname", "h", "port", 80.5)));
        assertThrows(ConfigurationException.class,
            () -> ConnectionInfo.fromMap(Map.of("hostname", "h")));
        assertThrows(ConfigurationException.class,
            () -> ConnectionInfo.fromMap(Map.of("hostname", "h", "port", 80, "protocol", "websocket")));
        assertThrows(ConfigurationException.class,
            () -> ConnectionInfo.fromMap(Map.of("hostname", "h", "port", 80, "tls", "yes")));
    }

    @Test
    void shouldRejectMutualTlsWithoutKeyInBlock() {
        Map<String, Object> tls = new HashMap<>();
        tls.put("enabled", true);
        tls.put("mtls", true);
        tls.put("cert_file", "/etc/client.pem");

        Map<String, Object> block = new HashMap<>();
        block.put("hostname", "localhost");
        block.put("port", 443);
        block.put("protocol", "http");
        block.put("tls", tls);

        assertThrows(ConfigurationException.class, () -> ConnectionInfo.fromMap(block));
    }

    @Test
    void shouldCompareByValue() {
        ConnectionInfo first = ConnectionInfo.builder().host("h").port(1).protocol(Protocol.HTTP).build();
        ConnectionInfo second = ConnectionInfo.builder().host("h").port(1).protocol(Protocol.HTTP).build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, ConnectionInfo.builder().host("h").port(1).build());
    }
}
