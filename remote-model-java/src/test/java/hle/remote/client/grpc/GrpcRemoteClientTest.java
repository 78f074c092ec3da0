package hle.remote.client.grpc;

import hle.remote.client.RemoteTimeoutException;
import hle.remote.codec.GsonPayloadCodec;
import hle.remote.config.ConnectionInfo;
import hle.remote.config.RemoteClientConfig;
import hle.remote.security.ResolvedCredentials;
import hle.remote.security.TransportSecurityResolver;
import hle.remote.signature.OperationShape;
import hle.remote.signature.TargetSignature;
import hle.remote.testing.SampleInput;
import hle.remote.testing.SampleOutput;
import hle.remote.testing.SampleTasks;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.MethodDescriptor;
import io.grpc.Server;
import io.grpc.ServerCall;
import io.grpc.ServerServiceDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GrpcRemoteClient flow control and argument checks.
 */
class GrpcRemoteClientTest {

    private static final OperationShape<SampleInput, SampleOutput> STREAM_IN =
        OperationShape.streamIn(SampleInput.class, SampleOutput.class);

    private Server server;
    private GrpcRemoteClient client;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.shutdownNow();
            server.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    @Timeout(20)
    void shouldStopPullingInputsWhileServerDoesNotRead() throws IOException {
        server = startServerThatNeverReads();
        client = newClient(Duration.ofSeconds(2));

        int total = 5000;
        AtomicInteger pulled = new AtomicInteger(0);
        String payload = "x".repeat(10 * 1024);
        Iterator<SampleInput> inputs = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return pulled.get() < total;
            }

            @Override
            public SampleInput next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                pulled.incrementAndGet();
                return new SampleInput(payload);
            }
        };

        assertThrows(RemoteTimeoutException.class, () -> client.streamIn(SampleTasks.RUN_STREAM_IN, STREAM_IN, inputs));

        // Flow-control windows hold a few MiB at most, i.e. some hundreds of 10 KiB inputs
        assertTrue(pulled.get() < 2000, "pulled " + pulled.get() + " of " + total + " inputs");
    }

    @Test
    void shouldRejectShapeOtherThanDeclared() throws IOException {
        server = startServerThatNeverReads();
        client = newClient(Duration.ofSeconds(2));

        OperationShape<SampleOutput, SampleOutput> wrong = OperationShape.streamIn(SampleOutput.class, SampleOutput.class);

        assertThrows(IllegalArgumentException.class,
            () -> client.streamIn(SampleTasks.RUN_STREAM_IN, wrong, List.<SampleOutput>of().iterator()));
        assertThrows(IllegalArgumentException.class,
            () -> client.unary("missing", OperationShape.unary(SampleInput.class, SampleOutput.class), new SampleInput("Test")));
    }

    private static Server startServerThatNeverReads() throws IOException {
        MethodDescriptor<SampleInput, SampleOutput> method = MethodDescriptor.<SampleInput, SampleOutput>newBuilder()
            .setType(MethodDescriptor.MethodType.CLIENT_STREAMING)
            .setFullMethodName(MethodDescriptor.generateFullMethodName(SampleTasks.SERVICE_NAME, SampleTasks.RUN_STREAM_IN))
            .setRequestMarshaller(new JsonMarshaller<>(new GsonPayloadCodec(), SampleInput.class))
            .setResponseMarshaller(new JsonMarshaller<>(new GsonPayloadCodec(), SampleOutput.class))
            .build();
        // No call.request(): the server accepts the call but never asks for a message
        ServerServiceDefinition service = ServerServiceDefinition.builder(SampleTasks.SERVICE_NAME)
            .addMethod(method, (call, headers) -> new ServerCall.Listener<SampleInput>() {
            })
            .build();
        return Grpc.newServerBuilderForPort(0, InsecureServerCredentials.create())
            .addService(service)
            .build()
            .start();
    }

    private GrpcRemoteClient newClient(Duration timeout) {
        TargetSignature signature = TargetSignature.builder(SampleTasks.TARGET_ID)
            .serviceName(SampleTasks.SERVICE_NAME)
            .streamIn(SampleTasks.RUN_STREAM_IN, SampleInput.class, SampleOutput.class)
            .build();
        ConnectionInfo connection = ConnectionInfo.builder()
            .host("localhost")
            .port(server.getPort())
            .timeout(timeout)
            .build();
        ResolvedCredentials credentials = new TransportSecurityResolver().resolve(null, connection.getProtocol());
        RemoteClientConfig config = RemoteClientConfig.builder()
            .workerThreads(2)
            .shutdownTimeout(Duration.ofSeconds(1))
            .build();
        return new GrpcRemoteClient(connection, signature, credentials, new GsonPayloadCodec(), config);
    }
}
