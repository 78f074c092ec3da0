package hle.remote.testing;

import hle.remote.client.grpc.GrpcRemoteClient;
import hle.remote.client.grpc.JsonMarshaller;
import hle.remote.codec.GsonPayloadCodec;
import hle.remote.codec.PayloadCodec;
import hle.remote.config.Protocol;
import io.grpc.Context;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Server;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerCredentials;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.TlsServerCredentials;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sample task service over gRPC with JSON messages, plaintext or TLS.
 */
public class GrpcSampleServer implements SampleServer {

    private static final Metadata.Key<String> TARGET_ID_KEY =
        Metadata.Key.of(GrpcRemoteClient.TARGET_ID_HEADER, Metadata.ASCII_STRING_MARSHALLER);

    /** Written to the wire as the JSON literal {@code null}. */
    private static final SampleOutput NULL_OUTPUT = new SampleOutput(null);

    private final List<String> targetIds = new CopyOnWriteArrayList<>();
    private final AtomicInteger requests = new AtomicInteger(0);
    private final Semaphore cancellations = new Semaphore(0);
    private final Server server;

    private GrpcSampleServer(ServerCredentials credentials) throws IOException {
        PayloadCodec codec = new GsonPayloadCodec();
        ServerServiceDefinition service = ServerServiceDefinition.builder(SampleTasks.SERVICE_NAME)
            .addMethod(method(MethodDescriptor.MethodType.UNARY, SampleTasks.RUN, codec),
                ServerCalls.asyncUnaryCall(this::run))
            .addMethod(method(MethodDescriptor.MethodType.CLIENT_STREAMING, SampleTasks.RUN_STREAM_IN, codec),
                ServerCalls.asyncClientStreamingCall(this::runStreamIn))
            .addMethod(method(MethodDescriptor.MethodType.SERVER_STREAMING, SampleTasks.RUN_STREAM_OUT, codec),
                ServerCalls.asyncServerStreamingCall(this::runStreamOut))
            .build();

        this.server = Grpc.newServerBuilderForPort(0, credentials)
            .addService(ServerInterceptors.intercept(service, new TargetIdRecorder()))
            .build()
            .start();
    }

    public static GrpcSampleServer start() {
        return start(InsecureServerCredentials.create());
    }

    /**
     * @param requireClientCertificate whether the server demands a certificate signed by the test CA
     */
    public static GrpcSampleServer startTls(boolean requireClientCertificate) {
        try {
            TlsServerCredentials.Builder builder = TlsServerCredentials.newBuilder()
                .keyManager(TestCertificates.serverCert().toFile(), TestCertificates.serverKey().toFile());
            if (requireClientCertificate) {
                builder.trustManager(TestCertificates.ca().toFile())
                    .clientAuth(TlsServerCredentials.ClientAuth.REQUIRE);
            }
            return start(builder.build());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static GrpcSampleServer start(ServerCredentials credentials) {
        try {
            return new GrpcSampleServer(credentials);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static MethodDescriptor<SampleInput, SampleOutput> method(MethodDescriptor.MethodType type,
                                                                      String operation, PayloadCodec codec) {
        return MethodDescriptor.<SampleInput, SampleOutput>newBuilder()
            .setType(type)
            .setFullMethodName(MethodDescriptor.generateFullMethodName(SampleTasks.SERVICE_NAME, operation))
            .setRequestMarshaller(new JsonMarshaller<>(codec, SampleInput.class))
            .setResponseMarshaller(new NullableOutputMarshaller(new JsonMarshaller<>(codec, SampleOutput.class)))
            .build();
    }

    private void run(SampleInput input, StreamObserver<SampleOutput> responses) {
        if (SampleTasks.FAIL.equals(input.getName())) {
            responses.onError(Status.INVALID_ARGUMENT.withDescription(SampleTasks.ERROR_MESSAGE).asRuntimeException());
            return;
        }
        if (SampleTasks.SLOW.equals(input.getName())) {
            SampleTasks.pause(SampleTasks.SLOW_MILLIS);
        }
        responses.onNext(SampleTasks.greet(input));
        responses.onCompleted();
    }

    private StreamObserver<SampleInput> runStreamIn(StreamObserver<SampleOutput> responses) {
        return new StreamObserver<SampleInput>() {
            private final List<SampleInput> inputs = new ArrayList<>();

            @Override
            public void onNext(SampleInput value) {
                inputs.add(value);
            }

            @Override
            public void onError(Throwable t) {
                inputs.clear();
            }

            @Override
            public void onCompleted() {
                responses.onNext(SampleTasks.greetAll(inputs));
                responses.onCompleted();
            }
        };
    }

    private void runStreamOut(SampleInput input, StreamObserver<SampleOutput> responses) {
        String name = input.getName();
        if (SampleTasks.ENDLESS.equals(name)) {
            emitUntilCancelled(input, responses);
            return;
        }
        if (SampleTasks.NULL_UNIT.equals(name)) {
            responses.onNext(SampleTasks.streamUnit(input));
            responses.onNext(NULL_OUTPUT);
            responses.onNext(SampleTasks.streamUnit(input));
            responses.onCompleted();
            return;
        }
        int units = SampleTasks.FAIL_AFTER_3.equals(name) ? 3 : SampleTasks.STREAM_OUT_UNITS;
        for (int i = 0; i < units; i++) {
            responses.onNext(SampleTasks.streamUnit(input));
        }
        if (SampleTasks.FAIL_AFTER_3.equals(name)) {
            responses.onError(Status.INTERNAL.withDescription("stream broke").asRuntimeException());
        } else {
            responses.onCompleted();
        }
    }

    private void emitUntilCancelled(SampleInput input, StreamObserver<SampleOutput> responses) {
        Context context = Context.current();
        try {
            for (int i = 0; i < 3000 && !context.isCancelled(); i++) {
                responses.onNext(SampleTasks.streamUnit(input));
                SampleTasks.pause(10);
            }
        } catch (StatusRuntimeException e) {
            // the call went away between the check and the write
        }
        if (context.isCancelled()) {
            cancellations.release();
        } else {
            responses.onCompleted();
        }
    }

    @Override
    public Protocol getProtocol() {
        return Protocol.GRPC;
    }

    @Override
    public int getPort() {
        return server.getPort();
    }

    @Override
    public List<String> getReceivedTargetIds() {
        return targetIds;
    }

    @Override
    public int getRequestCount() {
        return requests.get();
    }

    @Override
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        return cancellations.tryAcquire(timeout, unit);
    }

    @Override
    public void close() {
        server.shutdownNow();
        try {
            server.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static class NullableOutputMarshaller implements MethodDescriptor.Marshaller<SampleOutput> {
        private final MethodDescriptor.Marshaller<SampleOutput> json;

        NullableOutputMarshaller(MethodDescriptor.Marshaller<SampleOutput> json) {
            this.json = json;
        }

        @Override
        public InputStream stream(SampleOutput value) {
            if (value == NULL_OUTPUT) {
                return new ByteArrayInputStream("null".getBytes(StandardCharsets.UTF_8));
            }
            return json.stream(value);
        }

        @Override
        public SampleOutput parse(InputStream stream) {
            return json.parse(stream);
        }
    }

    private class TargetIdRecorder implements ServerInterceptor {
        @Override
        public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                     ServerCallHandler<ReqT, RespT> next) {
            requests.incrementAndGet();
            targetIds.add(String.valueOf(headers.get(TARGET_ID_KEY)));
            return next.startCall(call, headers);
        }
    }
}
