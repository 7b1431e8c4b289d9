package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.SyncError;
import com.basepulse.indexer.modules.chains.events.DistributionModeSet;
import com.basepulse.indexer.modules.chains.events.EventDecodeException;
import com.basepulse.indexer.modules.chains.events.FundsWithdrawn;
import com.basepulse.indexer.modules.chains.events.PollCreated;
import com.basepulse.indexer.modules.chains.events.PollEvent;
import com.basepulse.indexer.modules.chains.events.PollEventDecoder;
import com.basepulse.indexer.modules.chains.events.PollEventVisitor;
import com.basepulse.indexer.modules.chains.events.PollFunded;
import com.basepulse.indexer.modules.chains.events.RewardClaimed;
import com.basepulse.indexer.modules.chains.events.RewardDistributed;
import com.basepulse.indexer.modules.chains.events.Voted;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.web3j.protocol.core.methods.response.Log;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * Applies poll contract logs to the projection, one block at a time.
 * Every handler is idempotent, so any block may be applied again after a crash or a duplicate delivery.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollEventProcessor {

    private final PollEventDecoder decoder;
    private final PollCreatedSyncHandler pollCreatedHandler;
    private final PollFundedSyncHandler pollFundedHandler;
    private final VotedSyncHandler votedHandler;
    private final DistributionModeSetSyncHandler distributionModeSetHandler;
    private final RewardDistributedSyncHandler rewardDistributedHandler;
    private final RewardClaimedSyncHandler rewardClaimedHandler;
    private final FundsWithdrawnSyncHandler fundsWithdrawnHandler;
    private final SyncErrorRecorder errorRecorder;
    private final Tracer tracer;

    private static final List<String> NATURAL_KEY_CONSTRAINTS = List.of(
            "polls_chain_id_poll_id_key",
            "poll_votes_tx_hash_log_index_key",
            "distribution_logs_tx_hash_log_index_key");

    private final PollEventVisitor<Boolean> dispatcher = new HandlerDispatcher();

    /**
     * Apply all logs of one block in log index order.
     * A handler failure does not stop the remaining events, but the block is reported as not
     * checkpointable so it is retried as a whole.
     */
    public BlockResult applyBlock(Long chainId, long blockNumber, List<Log> logs) {
        if (logs == null || logs.isEmpty()) {
            return BlockResult.empty(blockNumber);
        }

        Span span = tracer.spanBuilder("PollEventProcessor.applyBlock")
                .setAttribute("chain.id", chainId)
                .setAttribute("block.number", blockNumber)
                .setAttribute("log.count", logs.size())
                .startSpan();
        try {
            int decodeErrors = 0;
            Map<String, PollEvent> unique = new LinkedHashMap<>();
            Map<String, Log> rawByKey = new LinkedHashMap<>();
            for (Log raw : logs) {
                try {
                    PollEvent event = decoder.decode(chainId, raw);
                    if (unique.putIfAbsent(event.getUniqueKey(), event) == null) {
                        rawByKey.put(event.getUniqueKey(), raw);
                    }
                } catch (EventDecodeException e) {
                    decodeErrors++;
                    log.warn("Skipping undecodable log in block {} on chain {}: {}", blockNumber, chainId, e.getMessage());
                    recordError(chainId, raw, SyncError.DECODE, e);
                }
            }

            List<PollEvent> ordered = new ArrayList<>(unique.values());
            ordered.sort(Comparator.comparingInt(PollEvent::getLogIndex));

            int applied = 0;
            int skipped = 0;
            int failed = 0;
            for (PollEvent event : ordered) {
                try {
                    if (dispatch(event)) {
                        applied++;
                    } else {
                        skipped++;
                    }
                } catch (DataIntegrityViolationException e) {
                    if (isNaturalKeyViolation(e)) {
                        // a concurrent writer inserted the same natural key first
                        log.debug("Event {} already applied (constraint): {}", event.getUniqueKey(), e.getMessage());
                        skipped++;
                    } else {
                        failed++;
                        handlerFailed(chainId, blockNumber, event, rawByKey.get(event.getUniqueKey()), span, e);
                    }
                } catch (RuntimeException e) {
                    failed++;
                    handlerFailed(chainId, blockNumber, event, rawByKey.get(event.getUniqueKey()), span, e);
                }
            }

            BlockResult result = new BlockResult(blockNumber, applied, skipped, decodeErrors, failed);
            if (applied > 0 || failed > 0 || decodeErrors > 0) {
                log.info("Block {} on chain {}: applied={}, skipped={}, decodeErrors={}, failed={}",
                        blockNumber, chainId, applied, skipped, decodeErrors, failed);
            }
            return result;
        } finally {
            span.end();
        }
    }

    /**
     * Apply a fetched range block by block, stopping at the first block that is not checkpointable
     * or when {@code keepRunning} turns false between blocks.
     *
     * @param logs logs of {@code [fromBlock, toBlock]}, in any order
     */
    public RangeResult applyRange(Long chainId, long fromBlock, long toBlock, List<Log> logs,
                                  BooleanSupplier keepRunning) {
        TreeMap<Long, List<Log>> byBlock = groupByBlock(logs);
        int applied = 0;
        int skipped = 0;
        int decodeErrors = 0;
        int blocks = 0;

        for (Map.Entry<Long, List<Log>> entry : byBlock.entrySet()) {
            long blockNumber = entry.getKey();
            if (blockNumber < fromBlock || blockNumber > toBlock) {
                log.warn("Ignoring {} logs of block {} outside requested range [{}, {}]",
                        entry.getValue().size(), blockNumber, fromBlock, toBlock);
                continue;
            }
            if (!keepRunning.getAsBoolean()) {
                return new RangeResult(blockNumber - 1, -1, blocks, applied, skipped, decodeErrors, true);
            }

            BlockResult result = applyBlock(chainId, blockNumber, entry.getValue());
            blocks++;
            applied += result.getApplied();
            skipped += result.getSkipped();
            decodeErrors += result.getDecodeErrors();
            if (!result.isCheckpointable()) {
                return new RangeResult(blockNumber - 1, blockNumber, blocks, applied, skipped, decodeErrors, false);
            }
        }
        return new RangeResult(toBlock, -1, blocks, applied, skipped, decodeErrors, false);
    }

    /**
     * @return true if the event changed projection state
     */
    public boolean dispatch(PollEvent event) {
        return event.accept(dispatcher);
    }

    static TreeMap<Long, List<Log>> groupByBlock(List<Log> logs) {
        TreeMap<Long, List<Log>> byBlock = new TreeMap<>();
        if (logs == null) {
            return byBlock;
        }
        for (Log raw : logs) {
            byBlock.computeIfAbsent(raw.getBlockNumber().longValueExact(), k -> new ArrayList<>()).add(raw);
        }
        return byBlock;
    }

    /**
     * True only for the unique constraints that identify an event; any other violation is a real failure.
     */
    static boolean isNaturalKeyViolation(DataIntegrityViolationException e) {
        String detail = e.getMessage() + " " + e.getMostSpecificCause().getMessage();
        return NATURAL_KEY_CONSTRAINTS.stream().anyMatch(detail::contains);
    }

    private void handlerFailed(Long chainId, long blockNumber, PollEvent event, Log raw, Span span,
                               RuntimeException e) {
        log.error("Handler failed for {} in block {} on chain {}: {}",
                event.getClass().getSimpleName(), blockNumber, chainId, e.getMessage(), e);
        span.recordException(e);
        recordError(chainId, raw, SyncError.HANDLER, e);
    }

    private void recordError(Long chainId, Log raw, String errorType, Throwable error) {
        if (raw == null) {
            return;
        }
        try {
            errorRecorder.record(chainId, raw, errorType, error);
        } catch (RuntimeException e) {
            log.error("Failed to record {} error for tx {}: {}", errorType, raw.getTransactionHash(), e.getMessage());
        }
    }

    private class HandlerDispatcher implements PollEventVisitor<Boolean> {

        @Override
        public Boolean visit(PollCreated event) {
            return pollCreatedHandler.handle(event);
        }

        @Override
        public Boolean visit(PollFunded event) {
            return pollFundedHandler.handle(event);
        }

        @Override
        public Boolean visit(Voted event) {
            return votedHandler.handle(event);
        }

        @Override
        public Boolean visit(DistributionModeSet event) {
            return distributionModeSetHandler.handle(event);
        }

        @Override
        public Boolean visit(RewardDistributed event) {
            return rewardDistributedHandler.handle(event);
        }

        @Override
        public Boolean visit(RewardClaimed event) {
            return rewardClaimedHandler.handle(event);
        }

        @Override
        public Boolean visit(FundsWithdrawn event) {
            return fundsWithdrawnHandler.handle(event);
        }
    }
}
