package hle.remote.client;

import hle.remote.config.RemoteClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools that run transport callbacks of a protocol client.
 */
public final class ClientExecutors {

    private static final Logger logger = LoggerFactory.getLogger(ClientExecutors.class);

    private ClientExecutors() {
    }

    /**
     * Creates a fixed pool with threads named {@code <prefix>-<clientId>-<n>}.
     */
    public static ExecutorService newWorkerPool(RemoteClientConfig config, String clientId) {
        String namePrefix = config.getThreadNamePrefix() + "-" + clientId;
        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(namePrefix + "-" + counter.incrementAndGet());
                thread.setDaemon(config.isDaemon());
                return thread;
            }
        };

        ThreadPoolExecutor pool = new ThreadPoolExecutor(
            config.getWorkerThreads(),
            config.getWorkerThreads(),
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            threadFactory
        );
        // Idle clients should not pin threads
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    /**
     * Orderly shutdown that falls back to {@link ExecutorService#shutdownNow()} after the timeout.
     */
    public static void shutdown(ExecutorService pool, Duration timeout) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Worker pool did not terminate within {}ms, forcing shutdown", timeout.toMillis());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
