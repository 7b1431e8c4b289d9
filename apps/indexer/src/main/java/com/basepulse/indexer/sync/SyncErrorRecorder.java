package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.SyncError;
import com.basepulse.indexer.repository.SyncErrorRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.web3j.protocol.core.methods.response.Log;

/**
 * Records logs that could not be decoded or applied. One open row per
 * (chain, txHash, logIndex, errorType); a repeated failure bumps its retry count.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncErrorRecorder {

    private static final int MAX_MESSAGE_LENGTH = 4000;

    private final SyncErrorRepository syncErrorRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncError record(Long chainId, Log rawLog, String errorType, Throwable error) {
        String txHash = rawLog.getTransactionHash() != null ? rawLog.getTransactionHash().toLowerCase() : null;
        Integer logIndex = rawLog.getLogIndex() != null ? rawLog.getLogIndex().intValue() : null;
        Long blockNumber = rawLog.getBlockNumber() != null ? rawLog.getBlockNumber().longValue() : 0L;

        SyncError row = syncErrorRepository
                .findFirstByChainIdAndTxHashAndLogIndexAndErrorTypeAndResolvedFalse(chainId, txHash, logIndex, errorType)
                .map(existing -> {
                    existing.setRetryCount(existing.getRetryCount() + 1);
                    return existing;
                })
                .orElseGet(() -> {
                    SyncError created = new SyncError();
                    created.setChainId(chainId);
                    created.setBlockNumber(blockNumber);
                    created.setTxHash(txHash);
                    created.setLogIndex(logIndex);
                    created.setErrorType(errorType);
                    created.setRawLog(toJson(rawLog));
                    return created;
                });
        row.setErrorMessage(truncate(describe(error)));
        return syncErrorRepository.save(row);
    }

    private String toJson(Log rawLog) {
        try {
            return objectMapper.writeValueAsString(rawLog);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize log {}/{}: {}", rawLog.getTransactionHash(), rawLog.getLogIndex(), e.getMessage());
            return rawLog.toString();
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static String truncate(String message) {
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
    }
}
