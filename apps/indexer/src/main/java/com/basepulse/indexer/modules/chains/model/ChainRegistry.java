package com.basepulse.indexer.modules.chains.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registry for all chain configurations
 * Loads from application.yaml basepulse.chains property
 */
@Component
@ConfigurationProperties(prefix = "basepulse")
public class ChainRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ChainRegistry.class);
    private List<ChainConfig> chains = new ArrayList<>();

    public List<ChainConfig> getChains() {
        return chains;
    }

    public void setChains(List<ChainConfig> chains) {
        this.chains = chains;
        // Validate all chains on set
        chains.forEach(ChainConfig::validate);
    }

    /**
     * Get all enabled chain configurations
     */
    public List<ChainConfig> getEnabledChains() {
        return chains.stream()
                .filter(ChainConfig::isEnabled)
                .collect(Collectors.toList());
    }

    /**
     * Get chain configuration by EVM chain ID (e.g., 8453)
     */
    public Optional<ChainConfig> getByChainId(Long chainId) {
        return chains.stream()
                .filter(c -> c.getChainId().equals(chainId))
                .findFirst();
    }

    /**
     * Log registry information
     */
    public void logRegistry() {
        logger.info("=== Chain Registry ===");
        chains.forEach(chain -> logger.info("Chain: {} (chainId: {}), enabled: {}, contract: {}, RPC-HTTP: {}, RPC-WS: {}",
                chain.getId(), chain.getChainId(), chain.isEnabled(), chain.getContractAddress(),
                chain.getRpcHttp(), chain.getRpcWs()));
    }
}
