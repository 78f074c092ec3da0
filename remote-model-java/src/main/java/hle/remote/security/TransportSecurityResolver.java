package hle.remote.security;

import hle.remote.client.ConfigurationException;
import hle.remote.config.Protocol;
import hle.remote.config.TlsConfig;
import io.grpc.ChannelCredentials;
import io.grpc.InsecureChannelCredentials;
import io.grpc.TlsChannelCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * Resolves a {@link TlsConfig} into credentials for one protocol, rejecting
 * combinations the protocol cannot honor.
 *
 * <p>The policy matrix:
 * <table>
 *   <caption>Transport security per protocol</caption>
 *   <tr><th></th><th>gRPC</th><th>HTTP</th></tr>
 *   <tr><td>disabled</td><td>plaintext</td><td>plaintext</td></tr>
 *   <tr><td>TLS</td><td>CA file or system roots</td><td>CA file or system roots</td></tr>
 *   <tr><td>mTLS</td><td>client cert + key</td><td>client cert + key</td></tr>
 *   <tr><td>insecure_verify</td><td>rejected</td><td>no chain or host name check</td></tr>
 * </table>
 *
 * <p>Every failure is a {@link ConfigurationException} raised before any network I/O.
 */
public class TransportSecurityResolver {

    private static final Logger logger = LoggerFactory.getLogger(TransportSecurityResolver.class);

    private final CredentialLoader credentialLoader;

    public TransportSecurityResolver() {
        this(new PemCredentialLoader());
    }

    public TransportSecurityResolver(CredentialLoader credentialLoader) {
        this.credentialLoader = Objects.requireNonNull(credentialLoader, "credentialLoader cannot be null");
    }

    /**
     * @param tls the security block of a connection; null means disabled
     * @param protocol the protocol the credentials are for
     * @return credentials usable by the client of {@code protocol}
     * @throws ConfigurationException if the combination is invalid or a referenced file is unusable
     */
    public ResolvedCredentials resolve(TlsConfig tls, Protocol protocol) {
        Objects.requireNonNull(protocol, "protocol cannot be null");
        if (tls == null || !tls.isEnabled()) {
            return plaintext(protocol);
        }
        if (protocol == Protocol.GRPC && tls.isInsecureVerify()) {
            throw new ConfigurationException(
                "insecure_verify is not supported for grpc: use a ca_file or disable TLS");
        }
        validateFiles(tls);
        switch (protocol) {
            case GRPC:
                return resolveGrpc(tls);
            case HTTP:
                return resolveHttp(tls);
            default:
                throw new ConfigurationException("Unsupported protocol " + protocol);
        }
    }

    private static ResolvedCredentials plaintext(Protocol protocol) {
        if (protocol == Protocol.GRPC) {
            return ResolvedCredentials.forGrpc(ResolvedCredentials.Mode.PLAINTEXT, InsecureChannelCredentials.create());
        }
        return ResolvedCredentials.forHttp(ResolvedCredentials.Mode.PLAINTEXT, false, null);
    }

    private ResolvedCredentials resolveGrpc(TlsConfig tls) {
        TlsChannelCredentials.Builder builder = TlsChannelCredentials.newBuilder();
        try {
            if (tls.getCaFile().isPresent()) {
                builder.trustManager(tls.getCaFile().get().toFile());
            }
            if (tls.isMutual()) {
                builder.keyManager(tls.getCertFile().get().toFile(), tls.getKeyFile().get().toFile());
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read TLS files for grpc: " + tls, e);
        }
        ChannelCredentials credentials = builder.build();
        return ResolvedCredentials.forGrpc(mode(tls), credentials);
    }

    private ResolvedCredentials resolveHttp(TlsConfig tls) {
        TrustManager[] trustManagers = null;
        if (tls.isInsecureVerify()) {
            if (tls.getCaFile().isPresent()) {
                logger.warn("insecure_verify is set, ignoring ca_file {}", tls.getCaFile().get());
            }
            logger.warn("Server certificate verification is disabled for this connection");
            trustManagers = new TrustManager[] {new InsecureTrustManager()};
        } else if (tls.getCaFile().isPresent()) {
            trustManagers = credentialLoader.trustManagers(tls.getCaFile().get());
        }

        KeyManager[] keyManagers = null;
        if (tls.isMutual()) {
            keyManagers = credentialLoader.keyManagers(tls.getCertFile().get(), tls.getKeyFile().get());
        }

        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            // null managers fall back to the JDK defaults (system trust roots, no client certificate)
            sslContext.init(keyManagers, trustManagers, null);
            return ResolvedCredentials.forHttp(mode(tls), !tls.isInsecureVerify(), sslContext);
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("Cannot initialize TLS for http: " + tls, e);
        }
    }

    private static ResolvedCredentials.Mode mode(TlsConfig tls) {
        return tls.isMutual() ? ResolvedCredentials.Mode.MUTUAL_TLS : ResolvedCredentials.Mode.TLS;
    }

    private static void validateFiles(TlsConfig tls) {
        if (tls.isMutual() && (tls.getCertFile().isEmpty() || tls.getKeyFile().isEmpty())) {
            throw new ConfigurationException("mutual TLS requires both cert_file and key_file");
        }
        if (!tls.isInsecureVerify()) {
            tls.getCaFile().ifPresent(file -> requireReadable("ca_file", file));
        }
        tls.getCertFile().ifPresent(file -> requireReadable("cert_file", file));
        tls.getKeyFile().ifPresent(file -> requireReadable("key_file", file));
    }

    private static void requireReadable(String key, Path file) {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new ConfigurationException(key + " " + file + " does not exist or is not readable");
        }
    }
}
