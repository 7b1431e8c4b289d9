package com.basepulse.indexer.sync;

import com.basepulse.indexer.config.SyncProperties;
import com.basepulse.indexer.modules.chains.model.ChainConfig;
import com.basepulse.indexer.modules.chains.model.ChainRegistry;
import com.basepulse.indexer.modules.chains.rpc.ChainClient;
import com.basepulse.indexer.modules.chains.rpc.RpcException;
import com.basepulse.indexer.modules.chains.rpc.Web3jChainClient;
import com.basepulse.indexer.service.ChainCheckpointService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs one {@link ChainSyncOrchestrator} per enabled chain, each on its own thread, and routes
 * operator resync requests to the right chain.
 */
@Component
public class ChainSyncManager {

    private static final Logger logger = LoggerFactory.getLogger(ChainSyncManager.class);
    private static final int MAX_RETAINED_JOBS = 100;

    private final ChainRegistry chainRegistry;
    private final ChainCheckpointService checkpointService;
    private final PollEventProcessor processor;
    private final HistoricalResyncService resyncService;
    private final SyncProperties syncProperties;
    private final Tracer tracer;

    private final Map<Long, ChainSyncOrchestrator> orchestrators = new ConcurrentHashMap<>();
    private final Map<Long, ChainClient> clients = new ConcurrentHashMap<>();
    private final Map<String, ResyncJob> jobs = new ConcurrentHashMap<>();
    private final ExecutorService chainExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "chain-sync");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService standaloneResyncExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "resync");
        t.setDaemon(true);
        return t;
    });

    public ChainSyncManager(ChainRegistry chainRegistry,
                            ChainCheckpointService checkpointService,
                            PollEventProcessor processor,
                            HistoricalResyncService resyncService,
                            SyncProperties syncProperties,
                            Tracer tracer) {
        this.chainRegistry = chainRegistry;
        this.checkpointService = checkpointService;
        this.processor = processor;
        this.resyncService = resyncService;
        this.syncProperties = syncProperties;
        this.tracer = tracer;
    }

    /**
     * Start sync loops for all enabled chains after application startup.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        if (!syncProperties.isEnabled()) {
            logger.info("Chain sync disabled (basepulse.sync.enabled=false)");
            return;
        }
        Span span = tracer.spanBuilder("ChainSyncManager.startAll").startSpan();
        try {
            chainRegistry.logRegistry();
            List<ChainConfig> chains = chainRegistry.getEnabledChains();
            if (chains.isEmpty()) {
                logger.warn("No enabled chains configured");
                return;
            }
            for (ChainConfig chain : chains) {
                try {
                    start(chain);
                } catch (RpcException e) {
                    logger.error("Failed to start sync for chain {}: {}", chain.getChainId(), e.getMessage(), e);
                    span.recordException(e);
                }
            }
            logger.info("Started sync for {} chain(s)", orchestrators.size());
        } finally {
            span.end();
        }
    }

    void start(ChainConfig chain) {
        ChainClient client = createClient(chain);
        ChainSyncOrchestrator orchestrator = createOrchestrator(chain, client);
        clients.put(chain.getChainId(), client);
        orchestrators.put(chain.getChainId(), orchestrator);
        chainExecutor.submit(orchestrator);
    }

    /**
     * Queue a historical replay. Runs on the chain's processing thread when its loop is running,
     * otherwise on a standalone worker with its own client.
     *
     * @throws IllegalArgumentException on a malformed range or unknown chain
     */
    public ResyncJob resync(Long chainId, long fromBlock, Long toBlock) {
        HistoricalResyncService.validateRange(fromBlock, toBlock);
        ChainConfig chain = chainRegistry.getByChainId(chainId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown chain " + chainId));

        ResyncJob job = new ResyncJob(chainId, fromBlock, toBlock);
        retain(job);
        ChainSyncOrchestrator orchestrator = orchestrators.get(chainId);
        if (orchestrator != null && orchestrator.isRunning()) {
            try {
                orchestrator.submitResync(job);
                logger.info("Resync {} queued on chain {} loop: [{}, {}]", job.getId(), chainId, fromBlock,
                        toBlock != null ? toBlock : "head");
                return job;
            } catch (IllegalStateException e) {
                logger.warn("Chain {} loop stopped before accepting resync {}: {}", chainId, job.getId(),
                        e.getMessage());
            }
        }

        standaloneResyncExecutor.submit(() -> runStandalone(chain, job));
        logger.info("Resync {} queued on standalone worker for chain {}: [{}, {}]", job.getId(), chainId, fromBlock,
                toBlock != null ? toBlock : "head");
        return job;
    }

    public Optional<ResyncJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<ChainSyncStatus> statuses() {
        List<ChainSyncStatus> statuses = new ArrayList<>();
        for (ChainConfig chain : chainRegistry.getChains()) {
            ChainSyncOrchestrator orchestrator = orchestrators.get(chain.getChainId());
            if (orchestrator != null) {
                statuses.add(orchestrator.status());
            } else {
                statuses.add(ChainSyncStatus.builder()
                        .chainId(chain.getChainId())
                        .name(chain.getName())
                        .state(SyncState.UNINITIALIZED)
                        .checkpoint(checkpointService.load(chain.getChainId()).orElse(null))
                        .build());
            }
        }
        return statuses;
    }

    @PreDestroy
    public void stopAll() {
        logger.info("Stopping {} chain sync loop(s)", orchestrators.size());
        orchestrators.values().forEach(ChainSyncOrchestrator::stop);
        for (ChainSyncOrchestrator orchestrator : orchestrators.values()) {
            try {
                if (!orchestrator.awaitTermination(syncProperties.getShutdownTimeoutMs())) {
                    logger.warn("Sync loop for chain {} did not stop within {}ms",
                            orchestrator.getChainId(), syncProperties.getShutdownTimeoutMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        chainExecutor.shutdownNow();
        standaloneResyncExecutor.shutdownNow();
        clients.values().forEach(ChainClient::close);
        clients.clear();
    }

    /**
     * Build and connect the node client for a chain.
     */
    protected ChainClient createClient(ChainConfig chain) {
        Web3jChainClient client = new Web3jChainClient(chain);
        try {
            client.connect();
        } catch (IOException e) {
            client.close();
            throw new RpcException("Failed to connect to chain " + chain.getChainId() + ": " + e.getMessage(), e);
        }
        return client;
    }

    protected ChainSyncOrchestrator createOrchestrator(ChainConfig chain, ChainClient client) {
        return new ChainSyncOrchestrator(chain, client, checkpointService, processor, resyncService,
                syncProperties, tracer);
    }

    private void runStandalone(ChainConfig chain, ResyncJob job) {
        job.markRunning();
        try (ChainClient client = createClient(chain)) {
            job.complete(resyncService.replay(client, job.getFromBlock(), job.getToBlock()));
        } catch (RuntimeException e) {
            logger.error("Resync {} on chain {} failed: {}", job.getId(), chain.getChainId(), e.getMessage(), e);
            job.fail(e);
        }
    }

    private void retain(ResyncJob job) {
        jobs.put(job.getId(), job);
        if (jobs.size() <= MAX_RETAINED_JOBS) {
            return;
        }
        Collection<ResyncJob> finished = jobs.values().stream()
                .filter(ResyncJob::isDone)
                .sorted(Comparator.comparing(ResyncJob::getSubmittedAt))
                .limit(jobs.size() - MAX_RETAINED_JOBS)
                .toList();
        finished.forEach(j -> jobs.remove(j.getId()));
    }
}
