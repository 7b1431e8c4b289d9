package com.basepulse.indexer.modules.chains.rpc;

import org.web3j.protocol.core.methods.response.Log;

import java.util.List;
import java.util.function.Consumer;

/**
 * Node access for one chain, scoped to the poll contract's events.
 */
public interface ChainClient extends AutoCloseable {

    Long getChainId();

    /**
     * @throws RpcException on transport or node error
     */
    long currentHeight();

    /**
     * Fetch the contract's logs in {@code [fromBlock, toBlock]}, ordered by block number then log index.
     *
     * @throws RpcException on transport or node error
     */
    List<Log> getLogs(long fromBlock, long toBlock);

    /**
     * Push stream of new logs starting at {@code fromBlock}. Delivery is at-least-once and ordered
     * only within one uninterrupted connection. Callbacks run on the client's own threads.
     */
    LogSubscription subscribe(long fromBlock, Consumer<Log> onLog, Consumer<Throwable> onError);

    @Override
    void close();
}
