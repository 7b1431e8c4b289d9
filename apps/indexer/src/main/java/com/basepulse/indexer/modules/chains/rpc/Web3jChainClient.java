package com.basepulse.indexer.modules.chains.rpc;

import com.basepulse.indexer.modules.chains.events.PollContractEvent;
import com.basepulse.indexer.modules.chains.model.ChainConfig;
import io.reactivex.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.http.HttpService;
import org.web3j.protocol.websocket.WebSocketService;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * web3j-backed chain client.
 * HTTP is used for head and historical queries; WebSocket, when configured, carries the live subscription.
 */
public class Web3jChainClient implements ChainClient {

    private static final Logger logger = LoggerFactory.getLogger(Web3jChainClient.class);

    static final Comparator<Log> LOG_ORDER = Comparator
            .comparing(Log::getBlockNumber)
            .thenComparing(Log::getLogIndex);

    private final ChainConfig chain;
    private final String contractAddress;
    private Web3j httpWeb3j;
    private WebSocketService webSocketService;
    private Web3j wsWeb3j;

    public Web3jChainClient(ChainConfig chain) {
        this.chain = chain;
        this.contractAddress = chain.getContractAddress().toLowerCase();
    }

    /**
     * Open the node connections
     */
    public synchronized void connect() throws IOException {
        this.httpWeb3j = Web3j.build(new HttpService(chain.getRpcHttp()));
        logger.info("Initialized HTTP client for chain {}: {}", chain.getId(), chain.getRpcHttp());

        String wsUrl = chain.getRpcWs();
        if (wsUrl != null && !wsUrl.isEmpty()) {
            try {
                this.webSocketService = new WebSocketService(wsUrl, true);
                webSocketService.connect();
                this.wsWeb3j = Web3j.build(webSocketService);
                logger.info("Connected to chain {} via WebSocket: {}", chain.getId(), wsUrl);
            } catch (IOException e) {
                logger.error("Failed to connect to chain {} via WebSocket: {}", chain.getId(), wsUrl, e);
                close();
                throw e;
            }
        }
    }

    @Override
    public Long getChainId() {
        return chain.getChainId();
    }

    @Override
    public long currentHeight() {
        try {
            EthBlockNumber response = httpWeb3j.ethBlockNumber().send();
            if (response.hasError()) {
                throw new RpcException("eth_blockNumber failed on chain " + chain.getId() + ": "
                        + response.getError().getMessage());
            }
            return response.getBlockNumber().longValueExact();
        } catch (IOException e) {
            throw new RpcException("eth_blockNumber failed on chain " + chain.getId(), e);
        }
    }

    @Override
    public List<Log> getLogs(long fromBlock, long toBlock) {
        if (fromBlock > toBlock) {
            return List.of();
        }
        EthFilter filter = contractFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)));
        try {
            EthLog response = httpWeb3j.ethGetLogs(filter).send();
            if (response.hasError()) {
                throw new RpcException(String.format("eth_getLogs [%d, %d] failed on chain %s: %s",
                        fromBlock, toBlock, chain.getId(), response.getError().getMessage()));
            }
            List<Log> logs = new ArrayList<>();
            for (EthLog.LogResult<?> result : response.getLogs()) {
                if (result instanceof EthLog.LogObject) {
                    logs.add(((EthLog.LogObject) result).get());
                }
            }
            logs.sort(LOG_ORDER);
            return logs;
        } catch (IOException e) {
            throw new RpcException(String.format("eth_getLogs [%d, %d] failed on chain %s",
                    fromBlock, toBlock, chain.getId()), e);
        }
    }

    @Override
    public LogSubscription subscribe(long fromBlock, Consumer<Log> onLog, Consumer<Throwable> onError) {
        Web3j web3j = wsWeb3j != null ? wsWeb3j : httpWeb3j;
        EthFilter filter = contractFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameterName.LATEST);
        logger.info("Subscribing to poll contract logs on chain {} from block {}", chain.getId(), fromBlock);
        Disposable disposable = web3j.ethLogFlowable(filter)
                .subscribe(
                        onLog::accept,
                        onError::accept,
                        () -> onError.accept(new RpcException("Log stream completed for chain " + chain.getId()))
                );
        return new DisposableLogSubscription(disposable);
    }

    private EthFilter contractFilter(DefaultBlockParameter from, DefaultBlockParameter to) {
        EthFilter filter = new EthFilter(from, to, contractAddress);
        filter.addOptionalTopics(PollContractEvent.allTopics().toArray(new String[0]));
        return filter;
    }

    @Override
    public synchronized void close() {
        if (webSocketService != null) {
            webSocketService.close();
            webSocketService = null;
        }
        if (wsWeb3j != null) {
            wsWeb3j.shutdown();
            wsWeb3j = null;
        }
        if (httpWeb3j != null) {
            httpWeb3j.shutdown();
            httpWeb3j = null;
            logger.info("Closed RPC clients for chain {}", chain.getId());
        }
    }

    private static final class DisposableLogSubscription implements LogSubscription {

        private final Disposable disposable;

        private DisposableLogSubscription(Disposable disposable) {
            this.disposable = disposable;
        }

        @Override
        public boolean isActive() {
            return !disposable.isDisposed();
        }

        @Override
        public void close() {
            if (!disposable.isDisposed()) {
                disposable.dispose();
            }
        }
    }
}
