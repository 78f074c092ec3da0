package hle.remote.client;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite, non-restartable sequence of decoded response units, in arrival order.
 *
 * <p>Closing the stream before it is exhausted cancels the underlying transport call.
 * A failure after partial delivery surfaces as a {@link RemoteStreamException} on the
 * next pull. Instances are meant for a single consuming thread.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (RemoteStream<Token> tokens = generate.call(prompt)) {
 *     while (tokens.hasNext()) {
 *         render(tokens.next());
 *     }
 * }
 * }</pre>
 *
 * @param <T> the type of a response unit
 */
public interface RemoteStream<T> extends Iterator<T>, AutoCloseable {

    /**
     * Gets the number of units handed out by {@link #next()} so far.
     */
    long getDeliveredCount();

    /**
     * Returns true once the stream is exhausted, failed or closed.
     */
    boolean isFinished();

    @Override
    void close();

    /**
     * Adapts this stream to a {@link Stream}. Closing the returned stream closes this one.
     */
    default Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(this::close);
    }
}
