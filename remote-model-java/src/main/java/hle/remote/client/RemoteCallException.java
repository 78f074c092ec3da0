package hle.remote.client;

/**
 * Thrown when the remote server returned an application-level failure.
 *
 * <p>The status is transport specific: the gRPC status code name (e.g. {@code INVALID_ARGUMENT})
 * or the HTTP status code as a string (e.g. {@code 400}).
 */
public class RemoteCallException extends RemoteClientException {

    private final String operation;
    private final String status;
    private final Object payload;

    public RemoteCallException(String operation, String status, Object payload, Throwable cause) {
        super(String.format("Remote operation '%s' failed with status %s: %s", operation, status, payload), cause);
        this.operation = operation;
        this.status = status;
        this.payload = payload;
    }

    public String getOperation() {
        return operation;
    }

    public String getStatus() {
        return status;
    }

    /**
     * Returns the decoded error body sent by the server, or its description when
     * the body could not be decoded. May be null.
     */
    public Object getPayload() {
        return payload;
    }
}
