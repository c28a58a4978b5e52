package im.arun.docoutline.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared bounded pool for per-document work in batch mode. Outline inference is CPU-bound,
 * so by default the pool is sized to the available processors.
 */
public final class ExecutorProvider {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorProvider.class);
    private static final int MAX_DEFAULT_WORKERS = 8;

    private static ExecutorService instance;

    private ExecutorProvider() {}

    public static synchronized ExecutorService getExecutor() {
        return getExecutor(0);
    }

    /**
     * @param workers pool size, or 0 or less for one worker per processor; only honoured
     *                when the pool is first created
     */
    public static synchronized ExecutorService getExecutor(int workers) {
        if (instance == null) {
            int size = workers > 0 ? workers : defaultWorkers();
            instance = Executors.newFixedThreadPool(size, new WorkerThreadFactory());
            logger.debug("Started document pool with {} workers", size);
        }
        return instance;
    }

    static int defaultWorkers() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_DEFAULT_WORKERS));
    }

    /**
     * Shuts down the shared executor, interrupting documents still in flight.
     */
    public static synchronized void shutdown() {
        if (instance != null) {
            instance.shutdownNow();
            instance = null;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "docoutline-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) -> logger.error("Uncaught error in {}", t.getName(), e));
            return thread;
        }
    }
}
