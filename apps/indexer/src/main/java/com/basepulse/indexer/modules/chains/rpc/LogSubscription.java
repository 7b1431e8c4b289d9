package com.basepulse.indexer.modules.chains.rpc;

/**
 * Handle for a live log subscription. Owned by whoever opened it.
 */
public interface LogSubscription extends AutoCloseable {

    boolean isActive();

    /**
     * Stop delivery. Idempotent.
     */
    @Override
    void close();
}
