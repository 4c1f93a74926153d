package com.enterprise.jobscheduler.dispatch;

import com.enterprise.jobscheduler.core.ErrorKind;
import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.logic.JobLogic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread pools behind the dispatcher.
 * The worker pool runs job logic bounded by the execution timeout; the dispatch pool
 * runs whole dispatches submitted asynchronously, so a dispatch never waits on its own pool.
 */
public class JobExecutor {

    private static final Logger logger = LoggerFactory.getLogger(JobExecutor.class);

    private final ThreadPoolExecutor workerPool;
    private final ThreadPoolExecutor dispatchPool;
    private final Duration executionTimeout;
    private final Duration shutdownTimeout;

    private final AtomicLong totalExecuted = new AtomicLong(0);
    private final AtomicLong totalCompleted = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);
    private final AtomicLong totalTimedOut = new AtomicLong(0);
    private final AtomicLong totalExecutionTime = new AtomicLong(0);

    public JobExecutor(int corePoolSize, int maximumPoolSize,
                       long keepAliveTime, TimeUnit unit,
                       int queueCapacity, Duration executionTimeout, Duration shutdownTimeout) {
        this.executionTimeout = executionTimeout;
        this.shutdownTimeout = shutdownTimeout;

        this.workerPool = new ThreadPoolExecutor(
            corePoolSize,
            maximumPoolSize,
            keepAliveTime,
            unit,
            new LinkedBlockingQueue<>(queueCapacity),
            new NamedThreadFactory("job-worker-"),
            new JobRejectedExecutionHandler()
        );

        this.dispatchPool = new ThreadPoolExecutor(
            corePoolSize,
            maximumPoolSize,
            keepAliveTime,
            unit,
            new LinkedBlockingQueue<>(queueCapacity),
            new NamedThreadFactory("job-dispatch-"),
            new JobRejectedExecutionHandler()
        );

        logger.info("JobExecutor initialized with core={}, max={}, keepAlive={}ms, timeout={}ms",
                   corePoolSize, maximumPoolSize, unit.toMillis(keepAliveTime), executionTimeout.toMillis());
    }

    /**
     * Run job logic on the worker pool and wait for it, at most the execution timeout.
     * Failures are returned as outcomes, never thrown.
     */
    public ExecutionOutcome execute(Job job, Map<String, Object> input, JobLogic logic) {
        totalExecuted.incrementAndGet();
        long startTime = System.currentTimeMillis();

        Future<Map<String, Object>> future;
        try {
            future = workerPool.submit(() -> logic.execute(job, input));
        } catch (RejectedExecutionException e) {
            totalFailed.incrementAndGet();
            return ExecutionOutcome.failure("Job execution rejected: " + e.getMessage(), e,
                                            ErrorKind.DISPATCH, elapsedSince(startTime));
        }

        try {
            Map<String, Object> output = future.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            long executionTime = elapsedSince(startTime);
            totalCompleted.incrementAndGet();
            logger.debug("Job {} completed successfully in {}ms", job.getId(), executionTime);
            return ExecutionOutcome.success(output, executionTime);

        } catch (TimeoutException e) {
            future.cancel(true);
            totalFailed.incrementAndGet();
            totalTimedOut.incrementAndGet();
            long executionTime = elapsedSince(startTime);
            logger.error("Job {} timed out after {}ms", job.getId(), executionTime);
            return ExecutionOutcome.failure("Job execution timed out after " + executionTimeout.toMillis() + "ms",
                                            e, ErrorKind.TIMEOUT, executionTime);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            totalFailed.incrementAndGet();
            long executionTime = elapsedSince(startTime);
            logger.warn("Job {} failed: {}", job.getId(), cause.getMessage());
            return ExecutionOutcome.failure(messageOf(cause), cause, ErrorKind.EXECUTION, executionTime);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            totalFailed.incrementAndGet();
            logger.error("Interrupted while waiting for job {}", job.getId());
            return ExecutionOutcome.failure("Job execution interrupted", e, ErrorKind.EXECUTION,
                                            elapsedSince(startTime));
        } finally {
            totalExecutionTime.addAndGet(elapsedSince(startTime));
        }
    }

    /**
     * Run work asynchronously on the dispatch pool
     *
     * @throws RejectedExecutionException if the dispatch pool is saturated or shut down
     */
    public <T> CompletableFuture<T> submit(Callable<T> work) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return work.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, dispatchPool);
    }

    private static long elapsedSince(long startTime) {
        return System.currentTimeMillis() - startTime;
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    /**
     * Get executor statistics
     */
    public ExecutorStatistics getStatistics() {
        return new ExecutorStatistics() {
            @Override
            public long getTotalExecuted() {
                return totalExecuted.get();
            }

            @Override
            public long getTotalCompleted() {
                return totalCompleted.get();
            }

            @Override
            public long getTotalFailed() {
                return totalFailed.get();
            }

            @Override
            public long getTotalTimedOut() {
                return totalTimedOut.get();
            }

            @Override
            public double getAverageExecutionTimeMs() {
                long executed = totalExecuted.get();
                return executed > 0 ? (double) totalExecutionTime.get() / executed : 0.0;
            }

            @Override
            public int getActiveThreadCount() {
                return workerPool.getActiveCount();
            }

            @Override
            public int getPoolSize() {
                return workerPool.getPoolSize();
            }

            @Override
            public int getMaximumPoolSize() {
                return workerPool.getMaximumPoolSize();
            }

            @Override
            public int getQueueSize() {
                return workerPool.getQueue().size() + dispatchPool.getQueue().size();
            }

            @Override
            public int getQueueRemainingCapacity() {
                return Math.min(workerPool.getQueue().remainingCapacity(),
                                dispatchPool.getQueue().remainingCapacity());
            }
        };
    }

    /**
     * Shutdown the executor gracefully
     */
    public CompletableFuture<Void> shutdown() {
        return CompletableFuture.runAsync(() -> {
            logger.info("Shutting down JobExecutor...");

            dispatchPool.shutdown();
            workerPool.shutdown();

            try {
                if (!dispatchPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Dispatch pool did not terminate gracefully, forcing shutdown");
                    dispatchPool.shutdownNow();
                }

                if (!workerPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Worker pool did not terminate gracefully, forcing shutdown");
                    workerPool.shutdownNow();
                }

                logger.info("JobExecutor shutdown completed");

            } catch (InterruptedException e) {
                logger.error("Interrupted during shutdown", e);
                dispatchPool.shutdownNow();
                workerPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        });
    }

    /**
     * Check if executor is running
     */
    public boolean isRunning() {
        return !workerPool.isShutdown() && !dispatchPool.isShutdown();
    }

    private static class NamedThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix;

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }

    private static class JobRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            logger.error("Job execution rejected - thread pool is full and queue is full");
            throw new RejectedExecutionException("Job execution rejected - system overloaded");
        }
    }

    /**
     * Statistics interface for the executor
     */
    public interface ExecutorStatistics {
        long getTotalExecuted();
        long getTotalCompleted();
        long getTotalFailed();
        long getTotalTimedOut();
        double getAverageExecutionTimeMs();
        int getActiveThreadCount();
        int getPoolSize();
        int getMaximumPoolSize();
        int getQueueSize();
        int getQueueRemainingCapacity();
    }
}
