package hle.remote.client;

import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Skeleton of a {@link RemoteStream}: look-ahead, delivery counting, sticky failures
 * and one-time release of the transport stream.
 *
 * <p>{@link #close()} may be called from another thread, e.g. when the owning client
 * shuts down; a pull blocked on the transport then ends without a failure.
 *
 * @param <T> the type of a response unit
 */
public abstract class AbstractRemoteStream<T> implements RemoteStream<T> {

    private final String operation;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private T lookahead;
    private boolean hasLookahead;
    private volatile boolean exhausted;
    private volatile boolean closed;
    private volatile RemoteClientException failure;
    private long deliveredCount;

    /**
     * @param operation the operation the stream belongs to
     * @param onRelease invoked exactly once, when the stream is exhausted, failed or closed
     */
    protected AbstractRemoteStream(String operation, Runnable onRelease) {
        this.operation = operation;
        this.onRelease = onRelease;
    }

    /**
     * Blocks until the next unit arrives or the server ends the stream.
     *
     * @return true if a unit is available from {@link #current()}, false at the end of the stream
     */
    protected abstract boolean advance();

    /**
     * Gets the unit made available by the last successful {@link #advance()}. Never null.
     */
    protected abstract T current();

    /**
     * Maps a failure raised by {@link #advance()} to the error taxonomy.
     *
     * @param deliveredCount units delivered before the failure
     */
    protected abstract RemoteClientException translateFailure(RuntimeException failure, long deliveredCount);

    /**
     * Cancels the transport call of a stream that is abandoned or failed before its end.
     * Must tolerate a call that already completed.
     */
    protected abstract void cancel();

    public String getOperation() {
        return operation;
    }

    @Override
    public boolean hasNext() {
        if (failure != null) {
            throw failure;
        }
        if (hasLookahead) {
            return true;
        }
        if (exhausted || closed) {
            return false;
        }
        try {
            if (!advance()) {
                exhausted = true;
                release();
                return false;
            }
            lookahead = current();
        } catch (RuntimeException e) {
            if (closed) {
                return false;
            }
            failure = translateFailure(e, deliveredCount);
            cancel();
            release();
            throw failure;
        }
        hasLookahead = true;
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream of '" + operation + "' has no more units");
        }
        T unit = lookahead;
        lookahead = null;
        hasLookahead = false;
        deliveredCount++;
        return unit;
    }

    @Override
    public long getDeliveredCount() {
        return deliveredCount;
    }

    @Override
    public boolean isFinished() {
        return exhausted || closed || failure != null;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        lookahead = null;
        hasLookahead = false;
        if (!exhausted && failure == null) {
            cancel();
        }
        release();
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }
}
