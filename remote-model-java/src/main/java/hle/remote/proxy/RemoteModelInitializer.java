package hle.remote.proxy;

import hle.remote.client.ConfigurationException;
import hle.remote.client.RemoteClient;
import hle.remote.client.grpc.GrpcRemoteClient;
import hle.remote.client.http.HttpRemoteClient;
import hle.remote.codec.GsonPayloadCodec;
import hle.remote.codec.PayloadCodec;
import hle.remote.config.ConnectionInfo;
import hle.remote.config.RemoteClientConfig;
import hle.remote.security.ResolvedCredentials;
import hle.remote.security.TransportSecurityResolver;
import hle.remote.signature.TargetSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link RemoteModel} proxies from a target signature and a connection descriptor.
 *
 * <p>Initialization resolves transport security, selects the protocol client and builds
 * the operation table. It performs no network I/O: an unreachable endpoint only shows
 * up on the first call. Every configuration problem is raised as a
 * {@link ConfigurationException} before a client exists.
 *
 * <p>One initializer can build any number of proxies; each proxy owns its own client.
 */
public class RemoteModelInitializer {

    private static final Logger logger = LoggerFactory.getLogger(RemoteModelInitializer.class);

    private final RemoteClientConfig config;
    private final PayloadCodec codec;
    private final TransportSecurityResolver securityResolver;

    public RemoteModelInitializer() {
        this(RemoteClientConfig.defaultConfig());
    }

    public RemoteModelInitializer(RemoteClientConfig config) {
        this(config, new GsonPayloadCodec(), new TransportSecurityResolver());
    }

    public RemoteModelInitializer(RemoteClientConfig config, PayloadCodec codec,
                                  TransportSecurityResolver securityResolver) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.securityResolver = Objects.requireNonNull(securityResolver, "securityResolver cannot be null");
    }

    /**
     * @throws ConfigurationException if the security settings cannot be honored by the protocol
     */
    public RemoteModel init(TargetSignature signature, ConnectionInfo connection) {
        Objects.requireNonNull(signature, "signature cannot be null");
        Objects.requireNonNull(connection, "connection cannot be null");

        ResolvedCredentials credentials = securityResolver.resolve(connection.getTls(), connection.getProtocol());
        RemoteClient client = newClient(signature, connection, credentials);
        RemoteModel model = new RemoteModel(signature, connection, credentials, client);

        logger.info("Initialized remote model {} at {} ({}, {} operations)",
            signature.getTargetId(), client.getEndpoint(), credentials.getMode(), signature.getOperations().size());
        return model;
    }

    /**
     * Parses the connection block with {@link ConnectionInfo#fromMap(Map)} and initializes from it.
     */
    public RemoteModel init(TargetSignature signature, Map<String, ?> connection) {
        return init(signature, ConnectionInfo.fromMap(connection));
    }

    private RemoteClient newClient(TargetSignature signature, ConnectionInfo connection,
                                   ResolvedCredentials credentials) {
        switch (connection.getProtocol()) {
            case GRPC:
                return new GrpcRemoteClient(connection, signature, credentials, codec, config);
            case HTTP:
                return new HttpRemoteClient(connection, signature, credentials, codec, config);
            default:
                throw new ConfigurationException("Unsupported protocol " + connection.getProtocol());
        }
    }

    public RemoteClientConfig getConfig() {
        return config;
    }
}
