package com.raditha.twx.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide worker pool for file tasks.
 * <p>
 * The first caller decides the size; later requests for a different size get
 * the existing pool. Threads are daemons so an idle pool never keeps the JVM
 * alive.
 */
public final class WorkerPools {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPools.class);

    private static final AtomicReference<Pool> SHARED = new AtomicReference<>();

    private record Pool(ExecutorService executor, int size) {
    }

    private WorkerPools() {
    }

    public static ExecutorService shared(int jobs) {
        if (jobs < 1) {
            throw new IllegalArgumentException("jobs must be >= 1, got: " + jobs);
        }
        Pool existing = SHARED.get();
        if (existing == null) {
            Pool created = new Pool(Executors.newFixedThreadPool(jobs, daemonThreads()), jobs);
            if (SHARED.compareAndSet(null, created)) {
                logger.debug("Created worker pool with {} threads", jobs);
                return created.executor();
            }
            created.executor().shutdownNow();
            existing = SHARED.get();
        }
        if (existing.size() != jobs) {
            logger.debug("Worker pool already running with {} threads, ignoring request for {}", existing.size(), jobs);
        }
        return existing.executor();
    }

    /**
     * Size of the shared pool, or 0 if none has been created.
     */
    public static int sharedSize() {
        Pool pool = SHARED.get();
        return pool == null ? 0 : pool.size();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "twx-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
