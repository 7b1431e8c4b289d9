package com.basepulse.indexer.modules.chains.events;

/**
 * A log that cannot be mapped to a poll contract event. Skipped, never fatal.
 */
public class EventDecodeException extends RuntimeException {

    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
