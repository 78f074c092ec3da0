package hle.remote.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Tuning of the protocol clients built by the remote model initializer.
 *
 * <p>Key considerations for production use:
 * <ul>
 *   <li>Worker threads only run transport callbacks, callers block on their own threads</li>
 *   <li>The stream-in batch bound caps memory used by the HTTP emulation of input streams</li>
 *   <li>Timeouts apply per call, never to the lifetime of a proxy. None is set by default,
 *       since a gRPC deadline would also cut off long-running streams</li>
 * </ul>
 */
public class RemoteClientConfig {

    private final Duration defaultTimeout;
    private final int maxStreamInBatchSize;
    private final int workerThreads;
    private final String threadNamePrefix;
    private final boolean daemon;
    private final Duration shutdownTimeout;

    private RemoteClientConfig(Builder builder) {
        this.defaultTimeout = builder.defaultTimeout;
        this.maxStreamInBatchSize = builder.maxStreamInBatchSize;
        this.workerThreads = builder.workerThreads;
        this.threadNamePrefix = builder.threadNamePrefix;
        this.daemon = builder.daemon;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RemoteClientConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Timeout applied to calls whose connection descriptor does not set one, if any.
     */
    public Optional<Duration> getDefaultTimeout() {
        return Optional.ofNullable(defaultTimeout);
    }

    public int getMaxStreamInBatchSize() {
        return maxStreamInBatchSize;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Resolves the timeout of a call made over the given connection. Empty means calls are unbounded.
     */
    public Optional<Duration> timeoutFor(ConnectionInfo connection) {
        return connection.getTimeout().or(this::getDefaultTimeout);
    }

    public static class Builder {
        private Duration defaultTimeout;
        private int maxStreamInBatchSize = 10_000;
        private int workerThreads = 4;
        private String threadNamePrefix = "remote-model";
        private boolean daemon = true;
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        private Builder() {}

        /**
         * Default: none, calls without a connection timeout run until the server answers
         */
        public Builder defaultTimeout(Duration defaultTimeout) {
            if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
                throw new IllegalArgumentException("defaultTimeout must be positive");
            }
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        /**
         * Maximum number of inputs the HTTP client materializes for one stream-in call.
         * The gRPC client streams its inputs and ignores this bound.
         *
         * Default: 10000
         */
        public Builder maxStreamInBatchSize(int maxStreamInBatchSize) {
            if (maxStreamInBatchSize < 1) {
                throw new IllegalArgumentException("maxStreamInBatchSize must be >= 1");
            }
            this.maxStreamInBatchSize = maxStreamInBatchSize;
            return this;
        }

        /**
         * Number of threads each client uses for transport callbacks.
         *
         * Default: 4
         */
        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        /**
         * Prefix for worker thread names, useful for debugging and monitoring.
         *
         * Default: "remote-model"
         */
        public Builder threadNamePrefix(String threadNamePrefix) {
            if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
                throw new IllegalArgumentException("threadNamePrefix must not be empty");
            }
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        /**
         * Whether worker threads are daemon threads. Daemon threads don't prevent JVM shutdown.
         *
         * Default: true
         */
        public Builder daemon(boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        /**
         * How long closing a proxy waits for in-flight calls before forcing the transport down.
         *
         * Default: 5 seconds
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must be >= 0");
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public RemoteClientConfig build() {
            return new RemoteClientConfig(this);
        }
    }
}
