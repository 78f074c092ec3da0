package hle.remote.security;

import hle.remote.config.Protocol;
import io.grpc.ChannelCredentials;

import javax.net.ssl.SSLContext;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated transport security for one protocol, ready to hand to that protocol's client.
 *
 * <p>gRPC credentials carry {@link ChannelCredentials}; HTTP credentials carry an
 * {@link SSLContext} unless the connection is plaintext.
 */
public final class ResolvedCredentials {

    /**
     * Security level of the resolved connection.
     */
    public enum Mode {
        PLAINTEXT,
        TLS,
        MUTUAL_TLS
    }

    private final Protocol protocol;
    private final Mode mode;
    private final boolean verifyServer;
    private final ChannelCredentials channelCredentials;
    private final SSLContext sslContext;

    private ResolvedCredentials(Protocol protocol, Mode mode, boolean verifyServer,
                                ChannelCredentials channelCredentials, SSLContext sslContext) {
        this.protocol = protocol;
        this.mode = mode;
        this.verifyServer = verifyServer;
        this.channelCredentials = channelCredentials;
        this.sslContext = sslContext;
    }

    static ResolvedCredentials forGrpc(Mode mode, ChannelCredentials credentials) {
        return new ResolvedCredentials(Protocol.GRPC, mode, mode != Mode.PLAINTEXT,
                Objects.requireNonNull(credentials, "credentials cannot be null"), null);
    }

    static ResolvedCredentials forHttp(Mode mode, boolean verifyServer, SSLContext sslContext) {
        return new ResolvedCredentials(Protocol.HTTP, mode, verifyServer, null, sslContext);
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public Mode getMode() {
        return mode;
    }

    public boolean isSecure() {
        return mode != Mode.PLAINTEXT;
    }

    /**
     * Whether the server's certificate chain and host name are verified.
     */
    public boolean isVerifyServer() {
        return verifyServer;
    }

    /**
     * @throws IllegalStateException if these credentials were not resolved for gRPC
     */
    public ChannelCredentials getChannelCredentials() {
        if (protocol != Protocol.GRPC) {
            throw new IllegalStateException("Channel credentials exist only for grpc, not " + protocol);
        }
        return channelCredentials;
    }

    /**
     * SSL context for the HTTP client; empty for plaintext.
     *
     * @throws IllegalStateException if these credentials were not resolved for HTTP
     */
    public Optional<SSLContext> getSslContext() {
        if (protocol != Protocol.HTTP) {
            throw new IllegalStateException("An SSL context exists only for http, not " + protocol);
        }
        return Optional.ofNullable(sslContext);
    }

    /**
     * URI scheme matching these credentials over HTTP.
     */
    public String getHttpScheme() {
        return isSecure() ? "https" : "http";
    }

    @Override
    public String toString() {
        return String.format("ResolvedCredentials[%s, %s, verifyServer=%s]", protocol, mode, verifyServer);
    }
}
