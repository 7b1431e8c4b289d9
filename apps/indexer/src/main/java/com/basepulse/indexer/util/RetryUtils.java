package com.basepulse.indexer.util;

import com.basepulse.indexer.modules.chains.rpc.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry utility for exponential backoff on transient node failures
 */
public final class RetryUtils {

    private static final Logger logger = LoggerFactory.getLogger(RetryUtils.class);
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private RetryUtils() {
    }

    /**
     * Execute with exponential backoff retry. Only {@link RpcException} is retried; anything else
     * propagates immediately.
     *
     * @param description    What is being attempted, for logging
     * @param task           Task to execute
     * @param maxRetries     Maximum number of retries after the first attempt
     * @param initialDelayMs Delay before the first retry
     * @param maxDelayMs     Cap for a single delay
     * @param <T>            Return type
     * @return Result from task execution
     * @throws RpcException If all retries failed or the thread was interrupted while waiting
     */
    public static <T> T executeWithRetry(String description,
                                         RetryableTask<T> task,
                                         int maxRetries,
                                         long initialDelayMs,
                                         long maxDelayMs) {
        long delayMs = initialDelayMs;
        RpcException lastException = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return task.execute();
            } catch (RpcException e) {
                lastException = e;
                if (attempt < maxRetries) {
                    long actualDelay = Math.min(delayMs, maxDelayMs);
                    logger.warn("{}: attempt {} failed, waiting {}ms before retry: {}",
                            description, attempt + 1, actualDelay, e.getMessage());
                    sleep(actualDelay);
                    delayMs = (long) (delayMs * BACKOFF_MULTIPLIER);
                } else {
                    logger.error("{}: all {} attempts exhausted", description, maxRetries + 1);
                }
            }
        }
        throw lastException;
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }

    /**
     * Functional interface for retryable task
     */
    @FunctionalInterface
    public interface RetryableTask<T> {
        T execute();
    }
}
