package com.basepulse.indexer.modules.chains.rpc;

/**
 * Thrown when a node call fails (transport error or JSON-RPC error).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
