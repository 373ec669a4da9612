package com.lwactors.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the executors actors run on.
 * Actors never own their executor: a pool built here is shared by any number
 * of actors and shut down by whoever created it.
 */
public class ThreadPoolFactory {
    // Default values
    private static final int DEFAULT_POOL_SIZE = Runtime.getRuntime().availableProcessors();
    private static final boolean DEFAULT_DAEMON_THREADS = true;

    private boolean useNamedThreads = true;
    private boolean daemonThreads = DEFAULT_DAEMON_THREADS;

    // Thread pool type configuration
    private ThreadPoolType executorType = ThreadPoolType.WORK_STEALING;
    private int fixedPoolSize = DEFAULT_POOL_SIZE;
    private int workStealingParallelism = DEFAULT_POOL_SIZE;

    /**
     * Enum defining the types of thread pools that can be used.
     */
    public enum ThreadPoolType {
        /**
         * Uses a fixed thread pool with a specified number of threads.
         * Good for CPU-bound workloads with a known optimal thread count.
         */
        FIXED,

        /**
         * Uses a work-stealing pool. Good default for many short actor activations.
         */
        WORK_STEALING,

        /**
         * Uses a single thread. Every actor on it runs on the same event loop.
         */
        SINGLE
    }

    /**
     * Enum defining the types of workloads the executor can be optimized for.
     */
    public enum WorkloadType {
        /**
         * Actions that block on IO. Uses more threads than cores.
         */
        IO_BOUND,

        /**
         * Actions doing intensive computation. One thread per core.
         */
        CPU_BOUND,

        /**
         * A mix of IO and CPU operations.
         */
        MIXED
    }

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Optimizes the thread pool configuration for a specific workload type.
     *
     * @param workloadType The type of workload to optimize for
     * @return This ThreadPoolFactory instance for method chaining
     */
    public ThreadPoolFactory optimizeFor(WorkloadType workloadType) {
        switch (workloadType) {
            case IO_BOUND:
                return setExecutorType(ThreadPoolType.FIXED)
                        .setFixedPoolSize(DEFAULT_POOL_SIZE * 4);
            case CPU_BOUND:
                return setExecutorType(ThreadPoolType.FIXED)
                        .setFixedPoolSize(DEFAULT_POOL_SIZE);
            case MIXED:
                return setExecutorType(ThreadPoolType.WORK_STEALING)
                        .setWorkStealingParallelism(DEFAULT_POOL_SIZE);
            default:
                throw new IllegalArgumentException("Unknown workload type: " + workloadType);
        }
    }

    /**
     * Creates an executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createExecutorService(String poolName) {
        switch (executorType) {
            case FIXED:
                if (useNamedThreads) {
                    return Executors.newFixedThreadPool(fixedPoolSize, createNamedThreadFactory(poolName + "-worker"));
                }
                return Executors.newFixedThreadPool(fixedPoolSize, createPlainThreadFactory());
            case WORK_STEALING:
                return new ForkJoinPool(workStealingParallelism, createForkJoinThreadFactory(poolName),
                        null, true);
            case SINGLE:
                if (useNamedThreads) {
                    return Executors.newSingleThreadExecutor(createNamedThreadFactory(poolName + "-loop"));
                }
                return Executors.newSingleThreadExecutor(createPlainThreadFactory());
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory that creates named threads
     */
    private ThreadFactory createNamedThreadFactory(String prefix) {
        AtomicInteger threadNumber = new AtomicInteger(1);
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
            thread.setDaemon(daemonThreads);
            return thread;
        };
    }

    private ThreadFactory createPlainThreadFactory() {
        return r -> {
            Thread thread = new Thread(r);
            thread.setDaemon(daemonThreads);
            return thread;
        };
    }

    private ForkJoinPool.ForkJoinWorkerThreadFactory createForkJoinThreadFactory(String poolName) {
        AtomicInteger threadNumber = new AtomicInteger(1);
        return pool -> {
            ForkJoinWorkerThread thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            if (useNamedThreads) {
                thread.setName(poolName + "-worker-" + threadNumber.getAndIncrement());
            }
            thread.setDaemon(daemonThreads);
            return thread;
        };
    }

    // Getters and setters

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        this.fixedPoolSize = Math.max(1, fixedPoolSize);
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        this.workStealingParallelism = Math.max(1, workStealingParallelism);
        return this;
    }
}
