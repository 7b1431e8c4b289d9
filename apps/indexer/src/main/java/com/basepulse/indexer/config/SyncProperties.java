package com.basepulse.indexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Chain sync configuration ({@code basepulse.sync.*}).
 */
@Component
@ConfigurationProperties(prefix = "basepulse.sync")
public class SyncProperties {

    public static final int DEFAULT_CHUNK_SIZE = 2000;
    public static final int MAX_CHUNK_SIZE = 10_000;

    /**
     * Start the per-chain listeners once the application is ready.
     */
    private boolean enabled = true;

    /**
     * Blocks per eth_getLogs request during backfill and catch-up.
     */
    private int chunkSize = DEFAULT_CHUNK_SIZE;

    /**
     * Resubscribe when the live subscription stays silent this long.
     */
    private long stallTimeoutMs = 60_000;

    /**
     * How long the live loop waits for a pushed log before re-checking stop and stall conditions.
     */
    private long pollIntervalMs = 1_000;

    /**
     * Retries for a single RPC call before the orchestrator backs off.
     */
    private int maxRetries = 5;

    private long retryInitialDelayMs = 1_000;

    private long retryMaxDelayMs = 60_000;

    /**
     * Pause before resuming at checkpoint+1 after a block failed to apply.
     */
    private long failureBackoffMs = 5_000;

    /**
     * Fetch the next backfill chunk while the current one is being applied.
     */
    private boolean prefetch = true;

    /**
     * Upper bound for draining in-flight blocks on shutdown.
     */
    private long shutdownTimeoutMs = 30_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    /**
     * Chunk size clamped to the provider-safe range.
     */
    public int resolveChunkSize() {
        if (chunkSize < 1) {
            return DEFAULT_CHUNK_SIZE;
        }
        return Math.min(chunkSize, MAX_CHUNK_SIZE);
    }

    public long getStallTimeoutMs() {
        return stallTimeoutMs;
    }

    public void setStallTimeoutMs(long stallTimeoutMs) {
        this.stallTimeoutMs = stallTimeoutMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryInitialDelayMs() {
        return retryInitialDelayMs;
    }

    public void setRetryInitialDelayMs(long retryInitialDelayMs) {
        this.retryInitialDelayMs = retryInitialDelayMs;
    }

    public long getRetryMaxDelayMs() {
        return retryMaxDelayMs;
    }

    public void setRetryMaxDelayMs(long retryMaxDelayMs) {
        this.retryMaxDelayMs = retryMaxDelayMs;
    }

    public long getFailureBackoffMs() {
        return failureBackoffMs;
    }

    public void setFailureBackoffMs(long failureBackoffMs) {
        this.failureBackoffMs = failureBackoffMs;
    }

    public boolean isPrefetch() {
        return prefetch;
    }

    public void setPrefetch(boolean prefetch) {
        this.prefetch = prefetch;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }
}
