package hle.remote.security;

import javax.net.ssl.KeyManager;
import javax.net.ssl.TrustManager;
import java.nio.file.Path;

/**
 * Turns referenced certificate and key files into JSSE managers.
 */
public interface CredentialLoader {

    /**
     * Key managers presenting the client certificate chain with its private key.
     *
     * @throws hle.remote.client.ConfigurationException if the files cannot be read or parsed
     */
    KeyManager[] keyManagers(Path certFile, Path keyFile);

    /**
     * Trust managers accepting servers whose chain ends at one of the given CA certificates.
     *
     * @throws hle.remote.client.ConfigurationException if the file cannot be read or parsed
     */
    TrustManager[] trustManagers(Path caFile);
}
