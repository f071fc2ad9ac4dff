package com.questrail.peerlink.internal.exec;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools owned by the client and server roles.
 *
 * <p>Each read loop parks a thread in a blocking receive for the lifetime of
 * its connection, so the read-loop pool must grow with the number of
 * connections. All threads are daemons. Whoever creates a pool here shuts it
 * down with {@link #shutdown(ExecutorService)}.</p>
 */
public final class RuntimeExecutors {

    private RuntimeExecutors() {}

    public static ExecutorService newReadLoopPool(String name) {
        return Executors.newCachedThreadPool(daemonThreadFactory(name));
    }

    public static ScheduledExecutorService newTimer(String name) {
        return Executors.newSingleThreadScheduledExecutor(daemonThreadFactory(name));
    }

    /**
     * Orderly shutdown with a bounded wait, then interrupt whatever is left.
     */
    public static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static ThreadFactory daemonThreadFactory(String name) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread t = new Thread(runnable, name + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
