package hle.remote.client.grpc;

import hle.remote.client.ClientExecutors;
import hle.remote.client.ConfigurationException;
import hle.remote.client.RemoteCallException;
import hle.remote.client.RemoteClient;
import hle.remote.client.RemoteClientException;
import hle.remote.client.RemoteConnectionException;
import hle.remote.client.RemoteStream;
import hle.remote.client.RemoteStreamException;
import hle.remote.client.RemoteTimeoutException;
import hle.remote.codec.PayloadCodec;
import hle.remote.config.ConnectionInfo;
import hle.remote.config.RemoteClientConfig;
import hle.remote.security.ResolvedCredentials;
import hle.remote.signature.OperationShape;
import hle.remote.signature.TargetSignature;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptors;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.MetadataUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link RemoteClient} over one persistent gRPC channel.
 *
 * <p>Operations map to RPCs named {@code <serviceName>/<operation>}; values travel as JSON
 * messages. The target id is attached to every call as the {@value #TARGET_ID_HEADER}
 * header. The channel connects lazily, so constructing a client performs no network I/O.
 *
 * <p>Stream-in calls honor flow control: the next input is pulled only once the transport
 * is ready to send it, so a slow server holds back the caller instead of filling buffers.
 *
 * <p>Error mapping:
 * <ul>
 *   <li>{@code UNAVAILABLE} - {@link RemoteConnectionException}</li>
 *   <li>{@code DEADLINE_EXCEEDED} - {@link RemoteTimeoutException}</li>
 *   <li>any status after at least one streamed unit - {@link RemoteStreamException}</li>
 *   <li>any other status - {@link RemoteCallException} carrying the status code name</li>
 * </ul>
 */
public class GrpcRemoteClient implements RemoteClient {

    private static final Logger logger = LoggerFactory.getLogger(GrpcRemoteClient.class);

    public static final String TARGET_ID_HEADER = "mm-model-id";
    static final Metadata.Key<String> TARGET_ID_KEY =
        Metadata.Key.of(TARGET_ID_HEADER, Metadata.ASCII_STRING_MARSHALLER);

    private final String id;
    private final String endpoint;
    private final TargetSignature signature;
    private final PayloadCodec codec;
    private final Duration timeout;
    private final Duration shutdownTimeout;
    private final ExecutorService workers;
    private final ManagedChannel managedChannel;
    private final Channel channel;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicInteger activeStreams = new AtomicInteger(0);

    /**
     * Builds the channel. Does not connect.
     *
     * @throws ConfigurationException if the transport rejects the credentials or options
     */
    public GrpcRemoteClient(ConnectionInfo connection, TargetSignature signature,
                            ResolvedCredentials credentials, PayloadCodec codec, RemoteClientConfig config) {
        this.id = "grpc-client-" + UUID.randomUUID().toString().substring(0, 8);
        this.endpoint = (credentials.isSecure() ? "grpcs://" : "grpc://") + connection.getAuthority();
        this.signature = signature;
        this.codec = codec;
        this.timeout = config.timeoutFor(connection).orElse(null);
        this.shutdownTimeout = config.getShutdownTimeout();
        this.workers = ClientExecutors.newWorkerPool(config, id);

        try {
            ManagedChannelBuilder<?> builder = Grpc.newChannelBuilderForAddress(
                    connection.getHost(), connection.getPort(), credentials.getChannelCredentials())
                .executor(workers)
                .userAgent("remote-model-java");
            connection.getMaxReceiveMessageLength().ifPresent(builder::maxInboundMessageSize);
            connection.getKeepAliveTimeMs().ifPresent(ms -> builder.keepAliveTime(ms, TimeUnit.MILLISECONDS));
            this.managedChannel = builder.build();
        } catch (IllegalArgumentException | UnsupportedOperationException e) {
            workers.shutdownNow();
            throw new ConfigurationException("Cannot build grpc channel to " + endpoint + ": " + e.getMessage(), e);
        }

        Metadata headers = new Metadata();
        headers.put(TARGET_ID_KEY, signature.getTargetId());
        this.channel = ClientInterceptors.intercept(managedChannel, MetadataUtils.newAttachHeadersInterceptor(headers));

        logger.debug("Created {} for {} ({} operations, {})",
            id, endpoint, signature.getOperations().size(), credentials.getMode());
    }

    private static <I, O> MethodDescriptor<I, O> methodDescriptor(String fullMethodName, OperationShape<I, O> shape,
                                                                  PayloadCodec codec) {
        return MethodDescriptor.<I, O>newBuilder()
            .setType(methodType(shape))
            .setFullMethodName(fullMethodName)
            .setRequestMarshaller(new JsonMarshaller<>(codec, shape.getInputType()))
            .setResponseMarshaller(new JsonMarshaller<>(codec, shape.getOutputType()))
            .build();
    }

    private static MethodDescriptor.MethodType methodType(OperationShape<?, ?> shape) {
        switch (shape.getCallKind()) {
            case STREAM_IN:
                return MethodDescriptor.MethodType.CLIENT_STREAMING;
            case STREAM_OUT:
                return MethodDescriptor.MethodType.SERVER_STREAMING;
            case UNARY:
            default:
                return MethodDescriptor.MethodType.UNARY;
        }
    }

    @Override
    public <I, O> O unary(String operation, OperationShape<I, O> shape, I input) {
        MethodDescriptor<I, O> method = method(operation, shape);
        logger.debug("[{}] unary {}", id, method.getFullMethodName());
        try {
            return ClientCalls.blockingUnaryCall(channel, method, callOptions(), input);
        } catch (StatusRuntimeException e) {
            throw translate(operation, e, 0);
        }
    }

    @Override
    public <I, O> O streamIn(String operation, OperationShape<I, O> shape, Iterator<? extends I> inputs) {
        MethodDescriptor<I, O> method = method(operation, shape);
        logger.debug("[{}] stream-in {}", id, method.getFullMethodName());

        ClientCall<I, O> call = channel.newCall(method, callOptions());
        StreamInObserver<I, O> observer = new StreamInObserver<>();
        ClientCalls.asyncClientStreamingCall(call, observer);

        long sent = 0;
        try {
            // Stop feeding once the server has answered or failed
            while (observer.awaitReady() && inputs.hasNext()) {
                observer.requests.onNext(inputs.next());
                sent++;
            }
        } catch (InterruptedException e) {
            call.cancel("Caller interrupted", e);
            Thread.currentThread().interrupt();
            throw new RemoteClientException("Interrupted while streaming inputs of '" + operation + "'", e);
        } catch (RuntimeException e) {
            observer.requests.onError(e);
            throw e;
        }
        observer.requests.onCompleted();
        logger.debug("[{}] stream-in {} sent {} messages", id, operation, sent);

        try {
            return observer.response.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StatusRuntimeException) {
                throw translate(operation, (StatusRuntimeException) cause, 0);
            }
            throw new RemoteClientException("Stream-in call '" + operation + "' failed", cause);
        } catch (InterruptedException e) {
            call.cancel("Caller interrupted", e);
            Thread.currentThread().interrupt();
            throw new RemoteClientException("Interrupted while waiting for '" + operation + "'", e);
        }
    }

    @Override
    public <I, O> RemoteStream<O> streamOut(String operation, OperationShape<I, O> shape, I input) {
        MethodDescriptor<I, O> method = method(operation, shape);
        logger.debug("[{}] stream-out {}", id, method.getFullMethodName());

        ClientCall<I, O> call = channel.newCall(method, callOptions());
        Iterator<O> responses;
        try {
            responses = ClientCalls.blockingServerStreamingCall(call, input);
        } catch (StatusRuntimeException e) {
            throw translate(operation, e, 0);
        }
        activeStreams.incrementAndGet();
        return new GrpcResponseStream<>(operation, call, responses,
            (failure, delivered) -> translateStreamFailure(operation, failure, delivered),
            activeStreams::decrementAndGet);
    }

    private RemoteClientException translateStreamFailure(String operation, RuntimeException failure, long delivered) {
        if (failure instanceof StatusRuntimeException) {
            return translate(operation, (StatusRuntimeException) failure, delivered);
        }
        if (delivered > 0) {
            return new RemoteStreamException(operation, delivered, failure);
        }
        if (failure instanceof RemoteClientException) {
            return (RemoteClientException) failure;
        }
        return new RemoteClientException("Stream of '" + operation + "' failed", failure);
    }

    private RemoteClientException translate(String operation, StatusRuntimeException e, long delivered) {
        if (delivered > 0) {
            return new RemoteStreamException(operation, delivered, translate(operation, e, 0));
        }
        Status status = e.getStatus();
        // A local decode failure comes back as INTERNAL with the codec error as cause
        if (status.getCause() instanceof RemoteClientException) {
            return (RemoteClientException) status.getCause();
        }
        switch (status.getCode()) {
            case UNAVAILABLE:
                return new RemoteConnectionException(endpoint,
                    "Cannot reach " + endpoint + ": " + status.getDescription(), e);
            case DEADLINE_EXCEEDED:
                return new RemoteTimeoutException(operation, timeout, e);
            default:
                return new RemoteCallException(operation, status.getCode().name(), status.getDescription(), e);
        }
    }

    private <I, O> MethodDescriptor<I, O> method(String operation, OperationShape<I, O> shape) {
        if (!open.get()) {
            throw new IllegalStateException("Client " + id + " is closed");
        }
        Optional<OperationShape<?, ?>> declared = signature.getOperation(operation);
        if (declared.isEmpty()) {
            throw new IllegalArgumentException("Unknown operation '" + operation + "'");
        }
        if (!declared.get().equals(shape)) {
            throw new IllegalArgumentException(String.format(
                "Operation '%s' is declared as %s, not %s", operation, declared.get(), shape));
        }
        return methodDescriptor(signature.rpcMethodName(operation), shape, codec);
    }

    private CallOptions callOptions() {
        if (timeout == null) {
            return CallOptions.DEFAULT;
        }
        return CallOptions.DEFAULT.withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public int getActiveStreamCount() {
        return activeStreams.get();
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        managedChannel.shutdown();
        try {
            if (!managedChannel.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("[{}] channel did not terminate within {}ms, cancelling in-flight calls",
                    id, shutdownTimeout.toMillis());
                managedChannel.shutdownNow();
            }
        } catch (InterruptedException e) {
            managedChannel.shutdownNow();
            Thread.currentThread().interrupt();
        }
        ClientExecutors.shutdown(workers, shutdownTimeout);
        logger.debug("Closed {} ({} streams still open)", id, activeStreams.get());
    }

    /**
     * Collects the single response of a client-streaming call and tracks whether the
     * transport can take another request message.
     */
    private static final class StreamInObserver<I, O> implements ClientResponseObserver<I, O> {
        private final CompletableFuture<O> response = new CompletableFuture<>();
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition readyOrDone = lock.newCondition();
        private ClientCallStreamObserver<I> requests;
        private O value;

        @Override
        public void beforeStart(ClientCallStreamObserver<I> requests) {
            this.requests = requests;
            requests.setOnReadyHandler(this::signal);
        }

        @Override
        public void onNext(O value) {
            this.value = value;
        }

        @Override
        public void onError(Throwable t) {
            response.completeExceptionally(t);
            signal();
        }

        @Override
        public void onCompleted() {
            response.complete(value);
            signal();
        }

        /**
         * Blocks until the transport accepts another message or the call has ended.
         *
         * @return false if the call has ended
         */
        boolean awaitReady() throws InterruptedException {
            lock.lock();
            try {
                while (!requests.isReady() && !response.isDone()) {
                    readyOrDone.await();
                }
                return !response.isDone();
            } finally {
                lock.unlock();
            }
        }

        private void signal() {
            lock.lock();
            try {
                readyOrDone.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}
