package hle.remote.config;

import hle.remote.client.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TlsConfig.
 */
class TlsConfigTest {

    @Test
    void shouldBeDisabledByDefault() {
        TlsConfig tls = TlsConfig.builder().build();

        assertFalse(tls.isEnabled());
        assertFalse(tls.isMutual());
        assertFalse(tls.isInsecureVerify());
        assertEquals(TlsConfig.disabled(), tls);
    }

    @Test
    void shouldImplyMutualFromClientCertificate() {
        TlsConfig tls = TlsConfig.builder()
            .enabled(true)
            .certFile(Paths.get("client.pem"))
            .keyFile(Paths.get("client-key.pem"))
            .build();

        assertTrue(tls.isMutual());
        assertEquals(Paths.get("client.pem"), tls.getCertFile().orElse(null));
        assertFalse(tls.getCaFile().isPresent());
    }

    @Test
    void shouldRequireBothClientFilesForMutualTls() {
        assertThrows(ConfigurationException.class,
            () -> TlsConfig.builder().enabled(true).mutual(true).build());
        assertThrows(ConfigurationException.class,
            () -> TlsConfig.builder().enabled(true).keyFile(Paths.get("client-key.pem")).build());
    }
}
