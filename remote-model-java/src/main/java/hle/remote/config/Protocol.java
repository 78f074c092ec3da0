package hle.remote.config;

import hle.remote.client.ConfigurationException;

import java.util.Locale;

/**
 * Wire protocols a remote model can be reached over.
 */
public enum Protocol {
    /** Native streaming RPC transport. */
    GRPC("grpc"),
    /** Request/response transport; streaming inputs are emulated with one batched request. */
    HTTP("http");

    private final String configName;

    Protocol(String configName) {
        this.configName = configName;
    }

    /**
     * The name used for this protocol in connection blocks.
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * Parses a protocol name as found in a connection block ({@code "grpc"} or {@code "http"}).
     *
     * @throws ConfigurationException if the name is missing or unknown
     */
    public static Protocol fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("protocol must be set");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Protocol protocol : values()) {
            if (protocol.configName.equals(normalized)) {
                return protocol;
            }
        }
        throw new ConfigurationException("Unknown protocol '" + name + "', expected grpc or http");
    }
}
