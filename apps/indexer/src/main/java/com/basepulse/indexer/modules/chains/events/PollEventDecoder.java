package com.basepulse.indexer.modules.chains.events;

import com.basepulse.indexer.entity.DistributionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.protocol.core.methods.response.Log;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes web3j Log objects into typed poll contract events.
 * Pure: no I/O, no state.
 */
@Component
public class PollEventDecoder {

    private static final Logger logger = LoggerFactory.getLogger(PollEventDecoder.class);

    /** 9999-12-31T23:59:59Z, the last second a SQL timestamp column holds everywhere */
    static final BigInteger MAX_TIMESTAMP_SECONDS = BigInteger.valueOf(253402300799L);

    /**
     * Decode a log emitted by the poll contract.
     *
     * @param chainId  EVM chain ID the log was read from
     * @param logEvent web3j Log object
     * @return the typed event
     * @throws EventDecodeException if the log is not a well-formed poll contract event
     */
    public PollEvent decode(Long chainId, Log logEvent) {
        List<String> topics = logEvent.getTopics();
        if (topics == null || topics.isEmpty()) {
            throw new EventDecodeException("Log has no topics: tx=" + logEvent.getTransactionHash());
        }
        PollContractEvent type = PollContractEvent.fromTopic(topics.get(0))
                .orElseThrow(() -> new EventDecodeException("Unrecognized event signature " + topics.get(0)
                        + ": tx=" + logEvent.getTransactionHash()));

        try {
            Event event = type.getEvent();
            List<Type> indexed = decodeIndexed(event, topics);
            List<Type> data = FunctionReturnDecoder.decode(logEvent.getData(), event.getNonIndexedParameters());
            if (data.size() != event.getNonIndexedParameters().size()) {
                throw new EventDecodeException(String.format("%s expects %d data values, got %d: tx=%s",
                        event.getName(), event.getNonIndexedParameters().size(), data.size(),
                        logEvent.getTransactionHash()));
            }

            long blockNumber = logEvent.getBlockNumber().longValueExact();
            String txHash = logEvent.getTransactionHash().toLowerCase();
            int logIndex = logEvent.getLogIndex().intValueExact();
            long pollId = uint(indexed.get(0)).longValueExact();

            PollEvent decoded = switch (type) {
                case POLL_CREATED -> new PollCreated(chainId, blockNumber, txHash, logIndex, pollId,
                        address(indexed.get(1)), ((Utf8String) data.get(0)).getValue(), uint(data.get(1)));
                case POLL_FUNDED -> new PollFunded(chainId, blockNumber, txHash, logIndex, pollId,
                        address(indexed.get(1)), address(data.get(0)), uint(data.get(1)));
                case VOTED -> new Voted(chainId, blockNumber, txHash, logIndex, pollId,
                        address(indexed.get(1)), uint(data.get(0)).longValueExact());
                case DISTRIBUTION_MODE_SET -> new DistributionModeSet(chainId, blockNumber, txHash, logIndex, pollId,
                        DistributionMode.fromOrdinal(uint(data.get(0)).intValueExact()), uint(data.get(1)));
                case REWARD_DISTRIBUTED -> new RewardDistributed(chainId, blockNumber, txHash, logIndex, pollId,
                        address(indexed.get(1)), address(data.get(0)), uint(data.get(1)), timestamp(data.get(2)));
                case REWARD_CLAIMED -> new RewardClaimed(chainId, blockNumber, txHash, logIndex, pollId,
                        address(indexed.get(1)), address(data.get(0)), uint(data.get(1)), timestamp(data.get(2)));
                case FUNDS_WITHDRAWN -> new FundsWithdrawn(chainId, blockNumber, txHash, logIndex, pollId,
                        address(indexed.get(1)), address(data.get(0)), uint(data.get(1)));
            };

            logger.debug("Decoded {}: chainId={}, blockNum={}, txHash={}, logIndex={}",
                    event.getName(), chainId, blockNumber, txHash, logIndex);
            return decoded;
        } catch (EventDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventDecodeException("Malformed " + type + " log: tx=" + logEvent.getTransactionHash()
                    + ", logIndex=" + logEvent.getLogIndex() + ": " + e.getMessage(), e);
        }
    }

    private List<Type> decodeIndexed(Event event, List<String> topics) {
        List<TypeReference<Type>> params = event.getIndexedParameters();
        if (topics.size() != params.size() + 1) {
            throw new EventDecodeException(String.format("%s expects %d topics, got %d",
                    event.getName(), params.size() + 1, topics.size()));
        }
        List<Type> values = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            values.add(FunctionReturnDecoder.decodeIndexedValue(topics.get(i + 1), params.get(i)));
        }
        return values;
    }

    private static BigInteger uint(Type value) {
        return (BigInteger) value.getValue();
    }

    private static BigInteger timestamp(Type value) {
        BigInteger seconds = uint(value);
        if (seconds.compareTo(MAX_TIMESTAMP_SECONDS) > 0) {
            throw new EventDecodeException("Timestamp out of range: " + seconds);
        }
        return seconds;
    }

    private static String address(Type value) {
        return ((Address) value).getValue().toLowerCase();
    }
}
