package hle.remote.client;

/**
 * Thrown when the remote endpoint cannot be reached or the TLS handshake fails
 * before any response unit was received.
 */
public class RemoteConnectionException extends RemoteClientException {

    private final String endpoint;

    public RemoteConnectionException(String endpoint, String message, Throwable cause) {
        super(message, cause, true);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
