package com.cajunsystems.service.config;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the threads a service runs on: one platform thread per worker and a
 * scheduler thread for pool maintenance. All threads are named and daemon, so a
 * forgotten service does not keep the JVM alive.
 */
public class WorkerThreadFactory {

    private final String prefix;
    private boolean daemon = true;

    /**
     * @param prefix the prefix for thread names, usually the service name
     */
    public WorkerThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Creates a thread factory for workers, naming threads {@code <prefix>-worker-<n>}.
     */
    public ThreadFactory workerThreads() {
        return createNamedThreadFactory(prefix + "-worker");
    }

    /**
     * Creates a single-threaded scheduled executor service.
     *
     * @param poolName Name of the scheduler, appended to the prefix
     * @return A new scheduled executor service
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        return Executors.newSingleThreadScheduledExecutor(
                createNamedThreadFactory(prefix + "-" + poolName + "-scheduler"));
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     *
     * @param threadPrefix The prefix for thread names
     * @return A thread factory that creates named threads
     */
    private ThreadFactory createNamedThreadFactory(String threadPrefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, threadPrefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(daemon);
                return thread;
            }
        };
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public WorkerThreadFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }
}
