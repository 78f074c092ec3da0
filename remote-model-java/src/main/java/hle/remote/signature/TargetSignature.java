package hle.remote.signature;

import hle.remote.client.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The callable operations of one remote target, keyed by operation name.
 *
 * <p>Besides the operations, a signature locates them on each transport:
 * <ul>
 *   <li>gRPC: full method name {@code <serviceName>/<operation>}</li>
 *   <li>HTTP: {@code POST <httpPathPrefix><operation>}, or
 *       {@code POST <httpPathPrefix>server-streaming-<operation>} for stream-out operations</li>
 * </ul>
 * The target id travels with every call so the server can route it to the right model.
 *
 * <p>Example usage:
 * <pre>{@code
 * TargetSignature signature = TargetSignature.builder("sentiment-v2")
 *     .serviceName("models.SentimentService")
 *     .unary("run", Document.class, Sentiment.class)
 *     .streamOut("run_stream_out", Document.class, Sentiment.class)
 *     .build();
 * }</pre>
 */
public final class TargetSignature {

    public static final String DEFAULT_HTTP_PATH_PREFIX = "/api/v1/task/";
    public static final String STREAM_OUT_HTTP_PREFIX = "server-streaming-";

    private final String targetId;
    private final String serviceName;
    private final String httpPathPrefix;
    private final Map<String, OperationShape<?, ?>> operations;

    private TargetSignature(Builder builder) {
        this.targetId = builder.targetId;
        this.serviceName = builder.serviceName != null ? builder.serviceName : builder.targetId;
        this.httpPathPrefix = builder.httpPathPrefix;
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.operations));
    }

    public static Builder builder(String targetId) {
        return new Builder(targetId);
    }

    public String getTargetId() {
        return targetId;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getHttpPathPrefix() {
        return httpPathPrefix;
    }

    /**
     * Operations in declaration order.
     */
    public Map<String, OperationShape<?, ?>> getOperations() {
        return operations;
    }

    public Set<String> getOperationNames() {
        return operations.keySet();
    }

    public Optional<OperationShape<?, ?>> getOperation(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    /**
     * Full gRPC method name of an operation.
     */
    public String rpcMethodName(String operation) {
        return serviceName + "/" + operation;
    }

    /**
     * HTTP path of an operation, depending on whether it streams its output.
     */
    public String httpPath(String operation) {
        OperationShape<?, ?> shape = operations.get(operation);
        if (shape != null && shape.getCallKind() == CallKind.STREAM_OUT) {
            return httpPathPrefix + STREAM_OUT_HTTP_PREFIX + operation;
        }
        return httpPathPrefix + operation;
    }

    @Override
    public String toString() {
        return String.format("TargetSignature[target=%s, service=%s, operations=%s]",
                targetId, serviceName, operations);
    }

    public static class Builder {
        private final String targetId;
        private String serviceName;
        private String httpPathPrefix = DEFAULT_HTTP_PATH_PREFIX;
        private final Map<String, OperationShape<?, ?>> operations = new LinkedHashMap<>();

        private Builder(String targetId) {
            this.targetId = targetId;
        }

        /**
         * gRPC service hosting the operations.
         *
         * Default: the target id
         */
        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        /**
         * Default: "/api/v1/task/"
         */
        public Builder httpPathPrefix(String httpPathPrefix) {
            this.httpPathPrefix = httpPathPrefix;
            return this;
        }

        public Builder operation(String name, OperationShape<?, ?> shape) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("operation name must not be empty");
            }
            if (name.indexOf('/') >= 0) {
                throw new ConfigurationException("operation name must not contain '/': " + name);
            }
            if (shape == null) {
                throw new ConfigurationException("operation '" + name + "' has no shape");
            }
            if (operations.putIfAbsent(name, shape) != null) {
                throw new ConfigurationException("operation '" + name + "' is declared twice");
            }
            return this;
        }

        public Builder unary(String name, Class<?> inputType, Class<?> outputType) {
            return operation(name, OperationShape.unary(inputType, outputType));
        }

        public Builder streamIn(String name, Class<?> inputType, Class<?> outputType) {
            return operation(name, OperationShape.streamIn(inputType, outputType));
        }

        public Builder streamOut(String name, Class<?> inputType, Class<?> outputType) {
            return operation(name, OperationShape.streamOut(inputType, outputType));
        }

        /**
         * @throws ConfigurationException if the target id is empty or no operation was declared
         */
        public TargetSignature build() {
            if (targetId == null || targetId.isBlank()) {
                throw new ConfigurationException("target id must not be empty");
            }
            if (serviceName != null && serviceName.isBlank()) {
                throw new ConfigurationException("service name must not be empty");
            }
            if (httpPathPrefix == null || !httpPathPrefix.startsWith("/")) {
                throw new ConfigurationException("http path prefix must start with '/' but was " + httpPathPrefix);
            }
            if (!httpPathPrefix.endsWith("/")) {
                httpPathPrefix = httpPathPrefix + "/";
            }
            if (operations.isEmpty()) {
                throw new ConfigurationException("target '" + targetId + "' declares no operations");
            }
            return new TargetSignature(this);
        }
    }
}
