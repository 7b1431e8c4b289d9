package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.DistributionEventType;
import com.basepulse.indexer.entity.DistributionLog;
import com.basepulse.indexer.entity.Poll;
import com.basepulse.indexer.modules.chains.events.PollEvent;
import com.basepulse.indexer.repository.DistributionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Appends distribution ledger rows keyed by (txHash, logIndex).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DistributionLedgerWriter {

    private final DistributionLogRepository distributionLogRepository;

    /**
     * Insert the ledger row for {@code event} unless it is already recorded.
     *
     * @param timestampSeconds unix seconds from the event, or null to stamp with the processing time
     * @return true if a new row was created
     */
    public boolean recordIfAbsent(Poll poll, PollEvent event, String recipient, String token,
                                  BigInteger amount, DistributionEventType eventType, BigInteger timestampSeconds) {
        if (distributionLogRepository.existsByTxHashAndLogIndex(event.getTxHash(), event.getLogIndex())) {
            log.debug("Ledger row already exists: txHash={}, logIndex={}, skipping",
                    event.getTxHash(), event.getLogIndex());
            return false;
        }

        DistributionLog row = new DistributionLog();
        row.setPollId(poll.getId());
        row.setRecipient(recipient.toLowerCase());
        row.setAmount(amount.toString());
        row.setToken(token.toLowerCase());
        row.setTxHash(event.getTxHash());
        row.setLogIndex(event.getLogIndex());
        row.setBlockNumber(event.getBlockNumber());
        row.setEventType(eventType.getValue());
        row.setTimestamp(toLocalDateTime(timestampSeconds));
        distributionLogRepository.save(row);
        return true;
    }

    static LocalDateTime toLocalDateTime(BigInteger timestampSeconds) {
        if (timestampSeconds == null) {
            return LocalDateTime.now(ZoneOffset.UTC);
        }
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(timestampSeconds.longValueExact()), ZoneOffset.UTC);
    }
}
