package hle.remote.proxy;

import hle.remote.client.RemoteClient;
import hle.remote.client.RemoteStream;
import hle.remote.config.ConnectionInfo;
import hle.remote.security.ResolvedCredentials;
import hle.remote.signature.CallKind;
import hle.remote.signature.OperationShape;
import hle.remote.signature.TargetSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Local stand-in for a remotely hosted model. Each operation declared by the target
 * signature is reachable by name and forwards to the protocol client chosen at init.
 *
 * <p>The operation table is fixed at construction. A proxy is safe to share between
 * threads; close it to release the channel and its worker threads.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (RemoteModel model = initializer.init(signature, connection)) {
 *     Greeting greeting = model.unary("run", Name.class, Greeting.class).call(new Name("Test"));
 *     try (RemoteStream<Greeting> stream = model.streamOut("run_stream_out", Name.class, Greeting.class)
 *             .callStreamOut(new Name("Test"))) {
 *         stream.forEachRemaining(System.out::println);
 *     }
 * }
 * }</pre>
 */
public class RemoteModel implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RemoteModel.class);

    private final TargetSignature signature;
    private final ConnectionInfo connection;
    private final ResolvedCredentials credentials;
    private final RemoteClient client;
    private final Map<String, RemoteOperation<?, ?>> operations;

    RemoteModel(TargetSignature signature, ConnectionInfo connection,
                ResolvedCredentials credentials, RemoteClient client) {
        this.signature = signature;
        this.connection = connection;
        this.credentials = credentials;
        this.client = client;

        Map<String, RemoteOperation<?, ?>> table = new LinkedHashMap<>();
        signature.getOperations().forEach((name, shape) -> table.put(name, forwarder(name, shape, client)));
        this.operations = Collections.unmodifiableMap(table);
    }

    private static <I, O> RemoteOperation<I, O> forwarder(String name, OperationShape<I, O> shape,
                                                          RemoteClient client) {
        return new RemoteOperation<>(name, shape, client);
    }

    /**
     * Gets an operation by name without type checks.
     *
     * @throws IllegalArgumentException if the signature declares no such operation
     */
    public RemoteOperation<?, ?> operation(String name) {
        RemoteOperation<?, ?> operation = operations.get(name);
        if (operation == null) {
            throw new IllegalArgumentException(String.format(
                "Target '%s' has no operation '%s', known operations: %s",
                signature.getTargetId(), name, operations.keySet()));
        }
        return operation;
    }

    /**
     * Gets an operation, checking that its declared value types are the given ones.
     *
     * @throws IllegalArgumentException if the operation is unknown or declares other types
     */
    public <I, O> RemoteOperation<I, O> operation(String name, Class<I> inputType, Class<O> outputType) {
        OperationShape<?, ?> declared = operation(name).getShape();
        OperationShape<I, O> shape = OperationShape.of(
            declared.getInputArity(), declared.getOutputArity(), inputType, outputType);
        if (!shape.equals(declared)) {
            throw new IllegalArgumentException(String.format(
                "Operation '%s' is declared as %s, not %s -> %s",
                name, declared, inputType.getSimpleName(), outputType.getSimpleName()));
        }
        return new RemoteOperation<>(name, shape, client);
    }

    public <I, O> RemoteOperation<I, O> unary(String name, Class<I> inputType, Class<O> outputType) {
        return typed(name, CallKind.UNARY, inputType, outputType);
    }

    public <I, O> RemoteOperation<I, O> streamIn(String name, Class<I> inputType, Class<O> outputType) {
        return typed(name, CallKind.STREAM_IN, inputType, outputType);
    }

    public <I, O> RemoteOperation<I, O> streamOut(String name, Class<I> inputType, Class<O> outputType) {
        return typed(name, CallKind.STREAM_OUT, inputType, outputType);
    }

    private <I, O> RemoteOperation<I, O> typed(String name, CallKind kind, Class<I> inputType, Class<O> outputType) {
        RemoteOperation<I, O> operation = operation(name, inputType, outputType);
        if (operation.getCallKind() != kind) {
            throw new IllegalArgumentException(String.format(
                "Operation '%s' is %s, not %s", name, operation.getCallKind(), kind));
        }
        return operation;
    }

    /**
     * Calls an operation by name with an untyped argument.
     *
     * @param argument one input value, or an {@link Iterable}, {@link Iterator} or
     *                 {@link java.util.stream.Stream} of them for stream-in operations
     * @return the decoded output, or a {@link RemoteStream} for stream-out operations
     * @see RemoteOperation#invoke(Object)
     */
    public Object invoke(String name, Object argument) {
        return operation(name).invoke(argument);
    }

    public Set<String> getOperationNames() {
        return operations.keySet();
    }

    public TargetSignature getSignature() {
        return signature;
    }

    public ConnectionInfo getConnectionInfo() {
        return connection;
    }

    public ResolvedCredentials getCredentials() {
        return credentials;
    }

    /**
     * Gets the endpoint the calls go to, e.g. {@code grpcs://models.internal:8085}.
     */
    public String getEndpoint() {
        return client.getEndpoint();
    }

    /**
     * Number of stream-out results handed out and not yet exhausted, failed or closed.
     */
    public int getActiveStreamCount() {
        return client.getActiveStreamCount();
    }

    public boolean isClosed() {
        return !client.isOpen();
    }

    /**
     * Releases the transport. Calls made afterwards fail with {@link IllegalStateException}.
     */
    @Override
    public void close() {
        if (!client.isOpen()) {
            return;
        }
        logger.info("Closing remote model {} at {}", signature.getTargetId(), client.getEndpoint());
        client.close();
    }

    @Override
    public String toString() {
        return String.format("RemoteModel[target=%s, endpoint=%s, operations=%s]",
            signature.getTargetId(), client.getEndpoint(), operations.keySet());
    }
}
