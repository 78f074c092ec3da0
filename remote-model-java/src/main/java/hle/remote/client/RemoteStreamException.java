package hle.remote.client;

/**
 * Thrown on the pull that follows a mid-stream failure. Units delivered before
 * the failure stay valid; {@link #getDeliveredCount()} says how many there were.
 */
public class RemoteStreamException extends RemoteClientException {

    private final String operation;
    private final long deliveredCount;

    public RemoteStreamException(String operation, long deliveredCount, Throwable cause) {
        super(String.format("Stream of remote operation '%s' failed after %d delivered units",
                operation, deliveredCount), cause);
        this.operation = operation;
        this.deliveredCount = deliveredCount;
    }

    public String getOperation() {
        return operation;
    }

    public long getDeliveredCount() {
        return deliveredCount;
    }
}
