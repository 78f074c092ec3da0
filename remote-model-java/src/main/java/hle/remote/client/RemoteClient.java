package hle.remote.client;

import hle.remote.signature.OperationShape;

import java.util.Iterator;

/**
 * Protocol client behind a remote model proxy. Implemented once per wire protocol:
 * <ul>
 *   <li>{@link hle.remote.client.grpc.GrpcRemoteClient} - native unary and streaming RPCs</li>
 *   <li>{@link hle.remote.client.http.HttpRemoteClient} - request/response, input streams batched</li>
 * </ul>
 *
 * <p>All protocol specific logic lives in the implementations. A client is created
 * once per proxy, never mutated afterwards, and safe for concurrent calls.
 */
public interface RemoteClient extends AutoCloseable {

    /**
     * Sends one value and waits for one value.
     *
     * @throws RemoteClientException if the call fails
     */
    <I, O> O unary(String operation, OperationShape<I, O> shape, I input);

    /**
     * Sends a sequence of values, in iteration order, and waits for one value.
     *
     * @throws RemoteClientException if the call fails
     */
    <I, O> O streamIn(String operation, OperationShape<I, O> shape, Iterator<? extends I> inputs);

    /**
     * Sends one value and returns the responses as a lazy stream. Blocks until the call
     * has been issued; each pull on the stream blocks until the next unit arrives.
     *
     * @throws RemoteClientException if the call cannot be issued
     */
    <I, O> RemoteStream<O> streamOut(String operation, OperationShape<I, O> shape, I input);

    /**
     * Gets the endpoint this client talks to, e.g. {@code grpc://localhost:8085}.
     */
    String getEndpoint();

    /**
     * Gets a unique identifier for this client instance. Useful for logging.
     */
    String getId();

    /**
     * Returns true until {@link #close()} is called.
     */
    boolean isOpen();

    /**
     * Gets the number of response streams that are neither exhausted, failed nor closed.
     */
    int getActiveStreamCount();

    /**
     * Releases the channel or client and the worker threads.
     */
    @Override
    void close();
}
