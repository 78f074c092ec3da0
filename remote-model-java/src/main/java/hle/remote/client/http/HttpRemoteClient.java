package hle.remote.client.http;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import hle.remote.client.ClientExecutors;
import hle.remote.client.RemoteCallException;
import hle.remote.client.RemoteClient;
import hle.remote.client.RemoteClientException;
import hle.remote.client.RemoteConnectionException;
import hle.remote.client.RemoteStream;
import hle.remote.client.RemoteStreamException;
import hle.remote.client.RemoteTimeoutException;
import hle.remote.codec.PayloadCodec;
import hle.remote.codec.PayloadCodecException;
import hle.remote.config.ConnectionInfo;
import hle.remote.config.RemoteClientConfig;
import hle.remote.security.ResolvedCredentials;
import hle.remote.signature.OperationShape;
import hle.remote.signature.TargetSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link RemoteClient} over HTTP/1.1 with JSON bodies.
 *
 * <p>Every call is a {@code POST} of the envelope
 * <pre>{@code {"model_id": "<target id>", "inputs": <value or array of values>}}</pre>
 * to the path the signature assigns to the operation.
 *
 * <p>HTTP has no client-streaming primitive usable here, so {@link #streamIn} drains the
 * whole input sequence into one JSON array and sends it as a single request. The input
 * must therefore be finite; more than {@link RemoteClientConfig#getMaxStreamInBatchSize()}
 * elements are rejected before anything is sent. Stream-out responses are read as
 * server-sent events, one unit per {@code data:} line.
 *
 * <p>Non-2xx statuses raise {@link RemoteCallException} with the status code and the
 * decoded error body. A configured timeout bounds connecting and each request until the
 * response headers arrive; without one, requests wait for the server indefinitely.
 * Closing the client closes every response stream still open.
 */
public class HttpRemoteClient implements RemoteClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpRemoteClient.class);

    static final String TARGET_ID_FIELD = "model_id";
    static final String INPUTS_FIELD = "inputs";

    private final String id;
    private final URI baseUri;
    private final TargetSignature signature;
    private final PayloadCodec codec;
    private final Duration timeout;
    private final int maxStreamInBatchSize;
    private final Duration shutdownTimeout;
    private final ExecutorService workers;
    private final HttpClient httpClient;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicInteger activeStreams = new AtomicInteger(0);
    private final Set<HttpEventStream<?>> liveStreams = ConcurrentHashMap.newKeySet();

    /**
     * Configures the HTTP client once. Does not connect.
     */
    public HttpRemoteClient(ConnectionInfo connection, TargetSignature signature,
                            ResolvedCredentials credentials, PayloadCodec codec, RemoteClientConfig config) {
        this.id = "http-client-" + UUID.randomUUID().toString().substring(0, 8);
        this.baseUri = URI.create(credentials.getHttpScheme() + "://" + connection.getAuthority());
        this.signature = signature;
        this.codec = codec;
        this.timeout = config.timeoutFor(connection).orElse(null);
        this.maxStreamInBatchSize = config.getMaxStreamInBatchSize();
        this.shutdownTimeout = config.getShutdownTimeout();
        this.workers = ClientExecutors.newWorkerPool(config, id);

        HttpClient.Builder builder = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NEVER)
            .executor(workers);
        if (timeout != null) {
            builder.connectTimeout(timeout);
        }
        credentials.getSslContext().ifPresent(builder::sslContext);
        this.httpClient = builder.build();

        logger.debug("Created {} for {} ({})", id, baseUri, credentials.getMode());
    }

    @Override
    public <I, O> O unary(String operation, OperationShape<I, O> shape, I input) {
        HttpRequest request = post(operation, envelope(codec.toJson(input)), "application/json");
        logger.debug("[{}] unary {}", id, request.uri());
        HttpResponse<String> response = send(operation, request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        checkStatus(operation, response.statusCode(), response.body());
        return codec.fromJson(parse(response.body()), shape.getOutputType());
    }

    @Override
    public <I, O> O streamIn(String operation, OperationShape<I, O> shape, Iterator<? extends I> inputs) {
        checkOperation(operation);
        JsonArray batch = new JsonArray();
        while (inputs.hasNext()) {
            if (batch.size() >= maxStreamInBatchSize) {
                throw new IllegalArgumentException(String.format(
                    "Stream-in input of '%s' exceeds the http batch limit of %d elements",
                    operation, maxStreamInBatchSize));
            }
            batch.add(codec.toJson(inputs.next()));
        }

        HttpRequest request = post(operation, envelope(batch), "application/json");
        logger.debug("[{}] stream-in {} with {} batched inputs", id, request.uri(), batch.size());
        HttpResponse<String> response = send(operation, request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        checkStatus(operation, response.statusCode(), response.body());
        return codec.fromJson(parse(response.body()), shape.getOutputType());
    }

    @Override
    public <I, O> RemoteStream<O> streamOut(String operation, OperationShape<I, O> shape, I input) {
        HttpRequest request = post(operation, envelope(codec.toJson(input)), "text/event-stream");
        logger.debug("[{}] stream-out {}", id, request.uri());
        HttpResponse<Stream<String>> response = send(operation, request, HttpResponse.BodyHandlers.ofLines());

        if (!isSuccess(response.statusCode())) {
            String body;
            try (Stream<String> lines = response.body()) {
                body = lines.collect(Collectors.joining("\n"));
            } catch (UncheckedIOException e) {
                body = e.getMessage();
            }
            checkStatus(operation, response.statusCode(), body);
        }

        activeStreams.incrementAndGet();
        HttpEventStream<O> stream = new HttpEventStream<>(operation, response.body(),
            data -> decodeUnit(operation, data, shape.getOutputType()),
            (failure, delivered) -> translateStreamFailure(operation, failure, delivered),
            activeStreams::decrementAndGet);
        liveStreams.removeIf(HttpEventStream::isFinished);
        liveStreams.add(stream);
        if (!open.get()) {
            // close() ran while the response was arriving
            stream.close();
        }
        return stream;
    }

    private <O> O decodeUnit(String operation, String data, Class<O> type) {
        O unit = codec.fromJson(parse(data), type);
        if (unit == null) {
            throw new PayloadCodecException("Stream of '" + operation + "' sent a null " + type.getSimpleName(), null);
        }
        return unit;
    }

    private JsonObject envelope(JsonElement inputs) {
        JsonObject body = new JsonObject();
        body.addProperty(TARGET_ID_FIELD, signature.getTargetId());
        body.add(INPUTS_FIELD, inputs);
        return body;
    }

    private HttpRequest post(String operation, JsonObject body, String accept) {
        checkOperation(operation);
        HttpRequest.Builder request = HttpRequest.newBuilder(baseUri.resolve(signature.httpPath(operation)))
            .header("Content-Type", "application/json")
            .header("Accept", accept)
            .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        if (timeout != null) {
            request.timeout(timeout);
        }
        return request.build();
    }

    private <T> HttpResponse<T> send(String operation, HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (HttpConnectTimeoutException e) {
            throw new RemoteConnectionException(baseUri.toString(),
                "Connecting to " + baseUri + " timed out: " + e.getMessage(), e);
        } catch (HttpTimeoutException e) {
            throw new RemoteTimeoutException(operation, timeout, e);
        } catch (IOException e) {
            throw new RemoteConnectionException(baseUri.toString(),
                "Request to " + request.uri() + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteClientException("Interrupted while calling '" + operation + "'", e);
        }
    }

    private RemoteClientException translateStreamFailure(String operation, RuntimeException failure, long delivered) {
        if (delivered > 0) {
            return new RemoteStreamException(operation, delivered, failure);
        }
        if (failure instanceof RemoteClientException) {
            return (RemoteClientException) failure;
        }
        Throwable cause = failure instanceof UncheckedIOException ? failure.getCause() : failure;
        if (cause instanceof HttpTimeoutException && !(cause instanceof HttpConnectTimeoutException)) {
            return new RemoteTimeoutException(operation, timeout, cause);
        }
        if (cause instanceof IOException) {
            return new RemoteConnectionException(baseUri.toString(),
                "Response stream of '" + operation + "' broke before the first unit: " + cause, cause);
        }
        return new RemoteClientException("Stream of '" + operation + "' failed", failure);
    }

    private static void checkStatus(String operation, int status, String body) {
        if (isSuccess(status)) {
            return;
        }
        Object payload;
        try {
            payload = body == null || body.isBlank() ? null : JsonParser.parseString(body);
        } catch (JsonParseException e) {
            payload = body;
        }
        throw new RemoteCallException(operation, String.valueOf(status), payload, null);
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static JsonElement parse(String json) {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new PayloadCodecException("Malformed JSON response: " + json, e);
        }
    }

    private void checkOperation(String operation) {
        if (!open.get()) {
            throw new IllegalStateException("Client " + id + " is closed");
        }
        if (signature.getOperation(operation).isEmpty()) {
            throw new IllegalArgumentException("Unknown operation '" + operation + "'");
        }
    }

    @Override
    public String getEndpoint() {
        return baseUri.toString();
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

    /**
     * Closes the open response streams and stops the worker threads. The JDK client releases
     * its connections once it is unreachable.
     */
    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        int streams = activeStreams.get();
        liveStreams.forEach(HttpEventStream::close);
        liveStreams.clear();
        ClientExecutors.shutdown(workers, shutdownTimeout);
        logger.debug("Closed {} ({} open streams closed)", id, streams);
    }
}
