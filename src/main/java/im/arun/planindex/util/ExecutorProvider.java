package im.arun.planindex.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared bounded daemon pool for page extraction. Keeps concurrent page work off the common
 * ForkJoinPool.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static volatile int configuredThreads;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Fix the pool size for the next pool created. {@code 0} or less restores the automatic size.
     * Has no effect on a pool that is already running.
     */
    public static void configure(int threads) {
        configuredThreads = threads;
    }

    /**
     * Page extraction mixes PDF parsing (CPU) with optional detector calls (network), so the
     * automatic size is twice the processor count, capped at 16.
     */
    static int poolSize() {
        if (configuredThreads > 0) {
            return configuredThreads;
        }
        return Math.min(Runtime.getRuntime().availableProcessors() * 2, 16);
    }

    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int poolSize = poolSize();
                    instance = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "planindex-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}
