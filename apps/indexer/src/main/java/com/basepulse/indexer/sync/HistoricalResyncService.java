package com.basepulse.indexer.sync;

import com.basepulse.indexer.config.SyncProperties;
import com.basepulse.indexer.modules.chains.rpc.ChainClient;
import com.basepulse.indexer.util.RetryUtils;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.protocol.core.methods.response.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * Replays a block range through the same handlers as live sync.
 * Handlers are idempotent, so a replay only fills gaps; it never moves the checkpoint and keeps
 * going past blocks that fail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoricalResyncService {

    private final PollEventProcessor processor;
    private final SyncProperties syncProperties;
    private final Tracer tracer;

    /**
     * Validate operator input before a job is queued.
     *
     * @throws IllegalArgumentException if the range is malformed
     */
    public static void validateRange(long fromBlock, Long toBlock) {
        if (fromBlock < 0) {
            throw new IllegalArgumentException("fromBlock must be >= 0, got " + fromBlock);
        }
        if (toBlock != null && toBlock < fromBlock) {
            throw new IllegalArgumentException("toBlock " + toBlock + " is before fromBlock " + fromBlock);
        }
    }

    public ResyncResult replay(ChainClient client, long fromBlock, Long toBlock) {
        return replay(client, fromBlock, toBlock, () -> true);
    }

    /**
     * @param toBlock last block to replay, or null for the node's current head
     * @throws IllegalArgumentException if the range is malformed or ends above the head
     */
    public ResyncResult replay(ChainClient client, long fromBlock, Long toBlock, BooleanSupplier keepRunning) {
        validateRange(fromBlock, toBlock);
        Long chainId = client.getChainId();
        long head = RetryUtils.executeWithRetry("chain " + chainId + " head", client::currentHeight,
                syncProperties.getMaxRetries(), syncProperties.getRetryInitialDelayMs(),
                syncProperties.getRetryMaxDelayMs());
        long to = toBlock != null ? toBlock : head;
        if (to > head) {
            throw new IllegalArgumentException("toBlock " + to + " is above chain head " + head);
        }
        if (fromBlock > to) {
            throw new IllegalArgumentException("fromBlock " + fromBlock + " is above chain head " + head);
        }

        Span span = tracer.spanBuilder("HistoricalResyncService.replay")
                .setAttribute("chain.id", chainId)
                .setAttribute("from.block", fromBlock)
                .setAttribute("to.block", to)
                .startSpan();
        try {
            log.info("Resync started: chain={}, range=[{}, {}]", chainId, fromBlock, to);
            int chunkSize = syncProperties.resolveChunkSize();
            int blocks = 0;
            int applied = 0;
            int skipped = 0;
            int decodeErrors = 0;
            List<Long> failedBlocks = new ArrayList<>();

            for (long start = fromBlock; start <= to; start += chunkSize) {
                long end = Math.min(start + chunkSize - 1, to);
                long chunkFrom = start;
                List<Log> logs = RetryUtils.executeWithRetry(
                        "chain " + chainId + " logs [" + chunkFrom + ", " + end + "]",
                        () -> client.getLogs(chunkFrom, end),
                        syncProperties.getMaxRetries(), syncProperties.getRetryInitialDelayMs(),
                        syncProperties.getRetryMaxDelayMs());

                TreeMap<Long, List<Log>> byBlock = PollEventProcessor.groupByBlock(logs);
                for (Map.Entry<Long, List<Log>> entry : byBlock.entrySet()) {
                    if (!keepRunning.getAsBoolean()) {
                        log.info("Resync interrupted: chain={}, at block {}", chainId, entry.getKey());
                        return new ResyncResult(chainId, fromBlock, to, blocks, applied, skipped, decodeErrors,
                                failedBlocks, true);
                    }
                    BlockResult result = processor.applyBlock(chainId, entry.getKey(), entry.getValue());
                    blocks++;
                    applied += result.getApplied();
                    skipped += result.getSkipped();
                    decodeErrors += result.getDecodeErrors();
                    if (!result.isCheckpointable()) {
                        failedBlocks.add(entry.getKey());
                    }
                }
            }

            ResyncResult result = new ResyncResult(chainId, fromBlock, to, blocks, applied, skipped, decodeErrors,
                    failedBlocks, false);
            if (failedBlocks.isEmpty()) {
                log.info("Resync finished: {}", result);
            } else {
                log.warn("Resync finished with failed blocks {}: {}", failedBlocks, result);
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
