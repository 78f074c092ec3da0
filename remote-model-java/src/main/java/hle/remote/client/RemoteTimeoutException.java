package hle.remote.client;

import java.time.Duration;

/**
 * Thrown when a single call does not complete within its configured timeout.
 */
public class RemoteTimeoutException extends RemoteClientException {

    private final Duration timeout;

    public RemoteTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(timeout != null
                ? String.format("Remote operation '%s' timed out after %dms", operation, timeout.toMillis())
                : String.format("Remote operation '%s' timed out", operation), cause, true);
        this.timeout = timeout;
    }

    /**
     * Gets the configured timeout, or null if the deadline was not set by this client.
     */
    public Duration getTimeout() {
        return timeout;
    }
}
