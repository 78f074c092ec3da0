package hle.remote.proxy;

import hle.remote.client.RemoteClient;
import hle.remote.client.RemoteStream;
import hle.remote.signature.Arity;
import hle.remote.signature.CallKind;
import hle.remote.signature.OperationShape;

import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Forwarder for one declared operation of a {@link RemoteModel}.
 *
 * <p>Each call checks the caller's argument against the operation's input arity and type,
 * then dispatches to the matching call shape of the protocol client. A mismatch raises
 * {@link IllegalArgumentException} without touching the network; invoking a method of
 * another call kind raises {@link IllegalStateException}.
 *
 * @param <I> the type of a single input value
 * @param <O> the type of a single output value
 */
public final class RemoteOperation<I, O> {

    private final String name;
    private final OperationShape<I, O> shape;
    private final RemoteClient client;

    RemoteOperation(String name, OperationShape<I, O> shape, RemoteClient client) {
        this.name = name;
        this.shape = shape;
        this.client = client;
    }

    public String getName() {
        return name;
    }

    public OperationShape<I, O> getShape() {
        return shape;
    }

    public CallKind getCallKind() {
        return shape.getCallKind();
    }

    /**
     * Calls a unary operation.
     */
    public O call(I input) {
        requireKind(CallKind.UNARY);
        return client.unary(name, shape, single(input));
    }

    /**
     * Calls a stream-in operation. Elements are pulled lazily, in order, while the call runs.
     */
    public O callStreamIn(Iterator<? extends I> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        return streamIn(inputs);
    }

    public O callStreamIn(Iterable<? extends I> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        return callStreamIn(inputs.iterator());
    }

    /**
     * Calls a stream-in operation and closes {@code inputs} afterwards.
     */
    public O callStreamIn(Stream<? extends I> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        try (Stream<? extends I> source = inputs) {
            return callStreamIn(source.iterator());
        }
    }

    /**
     * Calls a stream-out operation. The caller owns the returned stream and should close it
     * if it stops reading before the end.
     */
    public RemoteStream<O> callStreamOut(I input) {
        requireKind(CallKind.STREAM_OUT);
        return client.streamOut(name, shape, single(input));
    }

    /**
     * Untyped entry point: checks {@code argument} against the declared shape and dispatches.
     *
     * @param argument one input value, or an {@link Iterable}, {@link Iterator} or {@link Stream}
     *                 of input values for stream-in operations
     * @return the decoded output, or a {@link RemoteStream} for stream-out operations
     */
    public Object invoke(Object argument) {
        if (shape.getInputArity() == Arity.ONE) {
            I input = single(argument);
            return shape.getCallKind() == CallKind.STREAM_OUT ? callStreamOut(input) : call(input);
        }
        if (argument instanceof Iterator) {
            return streamIn((Iterator<?>) argument);
        }
        if (argument instanceof Iterable) {
            return streamIn(((Iterable<?>) argument).iterator());
        }
        if (argument instanceof Stream) {
            try (Stream<?> source = (Stream<?>) argument) {
                return streamIn(source.iterator());
            }
        }
        throw new IllegalArgumentException(String.format(
            "Operation '%s' expects a sequence of %s, got %s",
            name, shape.getInputType().getSimpleName(), describe(argument)));
    }

    private O streamIn(Iterator<?> inputs) {
        requireKind(CallKind.STREAM_IN);
        return client.streamIn(name, shape, new CheckedIterator<>(name, shape.getInputType(), inputs));
    }

    private I single(Object argument) {
        Class<I> inputType = shape.getInputType();
        if (inputType.isInstance(argument)) {
            return inputType.cast(argument);
        }
        if (argument instanceof Iterable || argument instanceof Iterator || argument instanceof Stream) {
            throw new IllegalArgumentException(String.format(
                "Operation '%s' expects a single %s, got a sequence", name, inputType.getSimpleName()));
        }
        throw new IllegalArgumentException(String.format(
            "Operation '%s' expects a %s, got %s", name, inputType.getSimpleName(), describe(argument)));
    }

    private void requireKind(CallKind expected) {
        if (shape.getCallKind() != expected) {
            throw new IllegalStateException(String.format(
                "Operation '%s' is %s, not %s", name, shape.getCallKind(), expected));
        }
    }

    private static String describe(Object argument) {
        return argument == null ? "null" : argument.getClass().getName();
    }

    @Override
    public String toString() {
        return name + ": " + shape;
    }

    /**
     * Checks each element as it is pulled, so a bad element fails the call at its position.
     */
    private static final class CheckedIterator<T> implements Iterator<T> {
        private final String operation;
        private final Class<T> type;
        private final Iterator<?> delegate;
        private long index;

        CheckedIterator(String operation, Class<T> type, Iterator<?> delegate) {
            this.operation = operation;
            this.type = type;
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public T next() {
            Object element = delegate.next();
            if (!type.isInstance(element)) {
                throw new IllegalArgumentException(String.format(
                    "Element %d of the input of '%s' is %s, expected %s",
                    index, operation, describe(element), type.getSimpleName()));
            }
            index++;
            return type.cast(element);
        }
    }
}
