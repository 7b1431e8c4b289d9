package com.basepulse.indexer.modules.chains.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration for a single chain the poll contract is deployed on
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChainConfig {

    /**
     * Unique identifier for the chain (e.g., "base", "base-sepolia")
     */
    private String id;

    /**
     * Human-readable chain name
     */
    private String name;

    /**
     * EVM chain ID (e.g., 8453 for Base)
     */
    private Long chainId;

    /**
     * Whether this chain is enabled for listening
     */
    private boolean enabled;

    /**
     * HTTP RPC endpoint, used for head and eth_getLogs queries
     */
    private String rpcHttp;

    /**
     * WebSocket RPC endpoint, optional; subscriptions fall back to HTTP filter polling
     */
    private String rpcWs;

    /**
     * Poll contract address
     */
    private String contractAddress;

    /**
     * First block to index when no checkpoint exists; 0 seeds the checkpoint at the chain head
     */
    private long startBlock;

    /**
     * Validate the configuration is complete
     */
    public void validate() {
        if (this.id == null || this.id.isEmpty()) {
            throw new IllegalArgumentException("Chain id cannot be empty");
        }
        if (this.chainId == null || this.chainId <= 0) {
            throw new IllegalArgumentException("Chain chainId must be positive");
        }
        if (this.startBlock < 0) {
            throw new IllegalArgumentException("Chain startBlock cannot be negative");
        }
        if (this.enabled && (this.rpcHttp == null || this.rpcHttp.isEmpty())) {
            throw new IllegalArgumentException("Chain rpcHttp cannot be empty for enabled chains");
        }
        if (this.enabled && (this.contractAddress == null || this.contractAddress.isEmpty())) {
            throw new IllegalArgumentException("Chain contractAddress cannot be empty for enabled chains");
        }
    }
}
