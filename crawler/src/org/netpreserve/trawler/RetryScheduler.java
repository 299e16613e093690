package org.netpreserve.trawler;

import org.netpreserve.trawler.util.NamedThreadFactory;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Puts failed URLs back on the work queue after an exponential backoff.
 * <p>
 * Retries still waiting when the scheduler is closed are dropped from memory only. Their frontier rows are
 * PENDING so they are reloaded on the next start.
 */
public class RetryScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);
    private static final int MAX_SHIFT = 20;
    private final WorkQueue queue;
    private final Duration baseDelay;
    private final ScheduledThreadPoolExecutor executor;

    public RetryScheduler(WorkQueue queue, Duration baseDelay) {
        this.queue = queue;
        this.baseDelay = baseDelay;
        this.executor = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("RetryScheduler"));
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    /**
     * Delay before the given retry attempt: {@code baseDelay * 2^(retryCount - 1)}.
     */
    public Duration backoff(int retryCount) {
        int shift = Math.min(Math.max(retryCount - 1, 0), MAX_SHIFT);
        return baseDelay.multipliedBy(1L << shift);
    }

    public void schedule(Url url, int retryCount) {
        Duration delay = backoff(retryCount);
        try {
            executor.schedule(() -> queue.offer(url), delay.toMillis(), TimeUnit.MILLISECONDS);
            log.atDebug().addKeyValue("url", url).addKeyValue("retryCount", retryCount)
                    .addKeyValue("delayMs", delay.toMillis()).log("Scheduled retry");
        } catch (RejectedExecutionException e) {
            log.atDebug().addKeyValue("url", url).log("Retry not scheduled, shutting down");
        }
    }

    /**
     * Number of retries waiting for their backoff to elapse.
     */
    public int pending() {
        return executor.getQueue().size();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
