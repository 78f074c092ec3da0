package hle.remote.client;

/**
 * Base exception for every failure surfaced by a remote model proxy.
 *
 * <p>The hierarchy mirrors the ways a remote call can go wrong:
 * <ul>
 *   <li>{@link ConfigurationException} - invalid descriptor, signature or security setup</li>
 *   <li>{@link RemoteConnectionException} - endpoint unreachable or TLS handshake failed</li>
 *   <li>{@link RemoteCallException} - the server answered with an application error</li>
 *   <li>{@link RemoteTimeoutException} - the call exceeded its deadline</li>
 *   <li>{@link RemoteStreamException} - a response stream broke after partial delivery</li>
 * </ul>
 *
 * <p>This layer never retries. {@link #isRetryable()} is a hint for callers that do.
 */
public class RemoteClientException extends RuntimeException {

    private final boolean retryable;

    protected RemoteClientException(String message) {
        this(message, null, false);
    }

    public RemoteClientException(String message, Throwable cause) {
        this(message, cause, false);
    }

    protected RemoteClientException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Returns true if repeating the same call could succeed (e.g., timeout, endpoint restarting).
     */
    public boolean isRetryable() {
        return retryable;
    }
}
