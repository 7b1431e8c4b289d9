package com.basepulse.indexer.sync;

import com.basepulse.indexer.config.SyncProperties;
import com.basepulse.indexer.modules.chains.model.ChainConfig;
import com.basepulse.indexer.modules.chains.rpc.ChainClient;
import com.basepulse.indexer.modules.chains.rpc.LogSubscription;
import com.basepulse.indexer.modules.chains.rpc.RpcException;
import com.basepulse.indexer.service.ChainCheckpointService;
import com.basepulse.indexer.service.CheckpointRegressionException;
import com.basepulse.indexer.util.RetryUtils;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.core.methods.response.Log;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one chain's projection in step with the contract: backfill from the checkpoint, then tail
 * the live subscription, catching up by range fetch after every reconnect.
 * <p>
 * All mutations run on the thread that calls {@link #run()}. The checkpoint only moves after a
 * block's mutations have committed.
 */
public class ChainSyncOrchestrator implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ChainSyncOrchestrator.class);

    private final ChainConfig chain;
    private final ChainClient client;
    private final ChainCheckpointService checkpointService;
    private final PollEventProcessor processor;
    private final HistoricalResyncService resyncService;
    private final SyncProperties properties;
    private final Tracer tracer;

    private final BlockingQueue<Log> liveQueue = new LinkedBlockingQueue<>();
    private final AtomicReference<Throwable> subscriptionError = new AtomicReference<>();
    private final Queue<ResyncJob> pendingResyncs = new ConcurrentLinkedQueue<>();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean running = true;
    private volatile SyncState state = SyncState.UNINITIALIZED;
    private volatile long checkpoint = -1;
    private volatile long lastHead = -1;
    private volatile String lastError;
    private volatile LocalDateTime lastBlockAt;
    private volatile LogSubscription subscription;
    private ExecutorService prefetchExecutor;

    public ChainSyncOrchestrator(ChainConfig chain,
                                 ChainClient client,
                                 ChainCheckpointService checkpointService,
                                 PollEventProcessor processor,
                                 HistoricalResyncService resyncService,
                                 SyncProperties properties,
                                 Tracer tracer) {
        this.chain = chain;
        this.client = client;
        this.checkpointService = checkpointService;
        this.processor = processor;
        this.resyncService = resyncService;
        this.properties = properties;
        this.tracer = tracer;
    }

    @Override
    public void run() {
        logger.info("Sync loop starting for chain {} ({})", chain.getChainId(), chain.getName());
        try {
            while (running) {
                try {
                    if (checkpoint < 0) {
                        initialize();
                    }
                    state = state == SyncState.UNINITIALIZED ? SyncState.BACKFILLING : SyncState.RECONNECTING;
                    catchUp();
                    if (running) {
                        tailLive();
                    }
                } catch (CheckpointRegressionException e) {
                    state = SyncState.FAILED;
                    lastError = e.getMessage();
                    logger.error("Chain {} sync halted: {}", chain.getChainId(), e.getMessage());
                    return;
                } catch (RuntimeException e) {
                    closeSubscription();
                    lastError = e.getMessage();
                    if (!running) {
                        break;
                    }
                    logger.warn("Chain {} sync interrupted, resuming from checkpoint {} in {}ms: {}",
                            chain.getChainId(), checkpoint, properties.getFailureBackoffMs(), e.getMessage());
                    if (state != SyncState.UNINITIALIZED) {
                        state = SyncState.RECONNECTING;
                    }
                    pause(properties.getFailureBackoffMs());
                }
            }
        } finally {
            closeSubscription();
            if (prefetchExecutor != null) {
                prefetchExecutor.shutdownNow();
            }
            if (state != SyncState.FAILED) {
                state = SyncState.STOPPED;
            }
            failPendingResyncs();
            terminated.countDown();
            logger.info("Sync loop for chain {} exited in state {}", chain.getChainId(), state);
        }
    }

    /**
     * Ask the loop to stop. The block in flight finishes; the loop exits before the next one.
     */
    public void stop() {
        running = false;
        stopSignal.countDown();
        closeSubscription();
    }

    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        return terminated.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Queue a replay to run on this chain's processing thread between blocks.
     *
     * @throws IllegalStateException if the loop is no longer running
     */
    public ResyncJob submitResync(ResyncJob job) {
        if (!running || terminated.getCount() == 0) {
            throw new IllegalStateException("Sync loop for chain " + chain.getChainId() + " is not running");
        }
        pendingResyncs.add(job);
        return job;
    }

    public ChainSyncStatus status() {
        return ChainSyncStatus.builder()
                .chainId(chain.getChainId())
                .name(chain.getName())
                .state(state)
                .checkpoint(checkpoint >= 0 ? checkpoint : null)
                .head(lastHead >= 0 ? lastHead : null)
                .lastError(lastError)
                .lastBlockAt(lastBlockAt)
                .pendingResyncs(pendingResyncs.size())
                .build();
    }

    public SyncState getState() {
        return state;
    }

    public Long getChainId() {
        return chain.getChainId();
    }

    public boolean isRunning() {
        return running && terminated.getCount() > 0;
    }

    private void initialize() {
        Long chainId = chain.getChainId();
        var stored = checkpointService.load(chainId);
        if (stored.isPresent()) {
            checkpoint = stored.get();
            logger.info("Chain {} resuming from checkpoint {}", chainId, checkpoint);
            return;
        }
        long seed = chain.getStartBlock() > 0 ? chain.getStartBlock() - 1 : fetchHead();
        checkpoint = checkpointService.initialize(chainId, seed);
    }

    /**
     * Range-fetch and apply {@code [checkpoint+1, head]} in chunks, advancing after each chunk.
     */
    void catchUp() {
        Long chainId = chain.getChainId();
        long head = fetchHead();
        if (checkpoint > head) {
            throw new CheckpointRegressionException(chainId, checkpoint, head);
        }
        checkpointService.verifyNotAhead(chainId, head);
        if (checkpoint >= head) {
            return;
        }

        int chunkSize = properties.resolveChunkSize();
        logger.info("Chain {} catching up [{}, {}] in chunks of {}", chainId, checkpoint + 1, head, chunkSize);
        long from = checkpoint + 1;
        long to = Math.min(from + chunkSize - 1, head);
        Future<List<Log>> prefetched = null;
        List<Log> logs = fetchLogs(from, to);
        try {
            while (running) {
                runPendingResyncs();
                long nextFrom = to + 1;
                long nextTo = Math.min(nextFrom + chunkSize - 1, head);
                if (properties.isPrefetch() && nextFrom <= head) {
                    prefetched = prefetch(nextFrom, nextTo);
                }

                Span span = tracer.spanBuilder("ChainSyncOrchestrator.backfillChunk")
                        .setAttribute("chain.id", chainId)
                        .setAttribute("from.block", from)
                        .setAttribute("to.block", to)
                        .startSpan();
                RangeResult result;
                try {
                    result = processor.applyRange(chainId, from, to, logs, () -> running);
                } finally {
                    span.end();
                }
                advanceTo(result.getLastCompleteBlock());
                if (result.failure().isPresent()) {
                    throw new BlockProcessingException(chainId, result.getFailedBlock(),
                            "Block " + result.getFailedBlock() + " on chain " + chainId + " not fully applied");
                }
                if (result.isInterrupted() || nextFrom > head) {
                    return;
                }

                from = nextFrom;
                to = nextTo;
                logs = prefetched != null ? await(prefetched) : fetchLogs(from, to);
                prefetched = null;
            }
        } finally {
            if (prefetched != null) {
                prefetched.cancel(true);
            }
        }
    }

    /**
     * Subscribe, close the gap since the last catch-up, then apply pushed logs until stopped or the
     * subscription fails or stalls.
     */
    private void tailLive() {
        Long chainId = chain.getChainId();
        liveQueue.clear();
        subscriptionError.set(null);
        subscription = client.subscribe(checkpoint + 1, liveQueue::offer,
                error -> subscriptionError.compareAndSet(null, error));
        catchUp();
        if (!running) {
            return;
        }
        state = SyncState.LIVE;
        logger.info("Chain {} live from block {}", chainId, checkpoint + 1);

        long lastActivity = System.currentTimeMillis();
        long pendingBlock = -1;
        boolean pendingFailed = false;
        while (running) {
            runPendingResyncs();
            Throwable error = subscriptionError.get();
            if (error != null) {
                throw new RpcException("Subscription for chain " + chainId + " failed: " + error.getMessage(), error);
            }

            Log next;
            try {
                next = liveQueue.poll(properties.getPollIntervalMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
                return;
            }
            long now = System.currentTimeMillis();
            if (next == null) {
                if (now - lastActivity > properties.getStallTimeoutMs()) {
                    throw new RpcException("Subscription for chain " + chainId + " silent for "
                            + (now - lastActivity) + "ms");
                }
                continue;
            }
            lastActivity = now;

            long block = next.getBlockNumber().longValueExact();
            if (block <= checkpoint) {
                logger.debug("Discarding live log of block {} at or below checkpoint {}", block, checkpoint);
                continue;
            }
            if (pendingBlock >= 0 && block > pendingBlock) {
                seal(pendingBlock, pendingFailed);
                pendingFailed = false;
            }
            if (block >= pendingBlock) {
                pendingBlock = block;
            } else {
                logger.warn("Chain {} delivered block {} after block {}", chainId, block, pendingBlock);
            }

            BlockResult result = processor.applyBlock(chainId, block, List.of(next));
            if (!result.isCheckpointable()) {
                if (block == pendingBlock) {
                    pendingFailed = true;
                } else {
                    throw new BlockProcessingException(chainId, block,
                            "Late log of block " + block + " on chain " + chainId + " not applied");
                }
            }
        }
    }

    private void seal(long blockNumber, boolean failed) {
        if (failed) {
            throw new BlockProcessingException(chain.getChainId(), blockNumber,
                    "Block " + blockNumber + " on chain " + chain.getChainId() + " not fully applied");
        }
        advanceTo(blockNumber);
    }

    private void advanceTo(long height) {
        if (height <= checkpoint) {
            return;
        }
        checkpointService.advance(chain.getChainId(), height);
        checkpoint = height;
        lastBlockAt = LocalDateTime.now();
    }

    private long fetchHead() {
        long head = RetryUtils.executeWithRetry("chain " + chain.getChainId() + " head", client::currentHeight,
                properties.getMaxRetries(), properties.getRetryInitialDelayMs(), properties.getRetryMaxDelayMs());
        lastHead = head;
        return head;
    }

    private List<Log> fetchLogs(long from, long to) {
        return RetryUtils.executeWithRetry("chain " + chain.getChainId() + " logs [" + from + ", " + to + "]",
                () -> client.getLogs(from, to),
                properties.getMaxRetries(), properties.getRetryInitialDelayMs(), properties.getRetryMaxDelayMs());
    }

    private Future<List<Log>> prefetch(long from, long to) {
        if (prefetchExecutor == null) {
            prefetchExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "prefetch-" + chain.getId());
                t.setDaemon(true);
                return t;
            });
        }
        return prefetchExecutor.submit(() -> fetchLogs(from, to));
    }

    private static List<Log> await(Future<List<Log>> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RpcException("Prefetch failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted waiting for prefetched logs", e);
        }
    }

    private void runPendingResyncs() {
        ResyncJob job;
        while (running && (job = pendingResyncs.poll()) != null) {
            job.markRunning();
            try {
                job.complete(resyncService.replay(client, job.getFromBlock(), job.getToBlock(), () -> running));
            } catch (RuntimeException e) {
                logger.error("Resync {} on chain {} failed: {}", job.getId(), chain.getChainId(), e.getMessage(), e);
                job.fail(e);
            }
        }
    }

    private void failPendingResyncs() {
        ResyncJob job;
        while ((job = pendingResyncs.poll()) != null) {
            job.fail(new IllegalStateException("Sync loop for chain " + chain.getChainId() + " stopped"));
        }
    }

    private void closeSubscription() {
        LogSubscription current = subscription;
        subscription = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing subscription for chain {}: {}", chain.getChainId(), e.getMessage());
            }
        }
    }

    private void pause(long millis) {
        try {
            stopSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
